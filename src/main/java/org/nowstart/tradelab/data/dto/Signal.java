package org.nowstart.tradelab.data.dto;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.nowstart.tradelab.data.type.SignalType;

/**
 * Immutable strategy instruction.
 *
 * <p>{@code requestedQuantity} is null when the strategy leaves sizing to the executor. {@code strength}
 * is advisory only and never changes how the engine sizes or prices a fill.
 */
public record Signal(
        String symbol,
        SignalType type,
        double price,
        LocalDateTime timestamp,
        double strength,
        Long requestedQuantity,
        Map<String, SignalAttribute> attributes
) {

    public Signal {
        if (type == null) {
            throw new IllegalArgumentException("signal type is required");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("signal timestamp is required");
        }
        if (!Double.isFinite(strength) || strength < 0.0) {
            throw new IllegalArgumentException("signal strength must be finite and >= 0");
        }
        if (requestedQuantity != null && requestedQuantity < 0) {
            throw new IllegalArgumentException("requested quantity must be >= 0");
        }
        symbol = symbol == null ? "" : symbol;
        attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static Signal of(
            SignalType type,
            Bar bar,
            double strength,
            List<SignalAttribute> attributes
    ) {
        Map<String, SignalAttribute> byKey = new LinkedHashMap<>();
        for (SignalAttribute attribute : attributes) {
            byKey.put(attribute.key(), attribute);
        }
        return new Signal("", type, bar.close(), bar.date().atStartOfDay(), strength, null, byKey);
    }

    public LocalDate date() {
        return timestamp.toLocalDate();
    }

    public Signal withSymbol(String newSymbol) {
        return new Signal(newSymbol, type, price, timestamp, strength, requestedQuantity, attributes);
    }

    public Signal withRequestedQuantity(Long quantity) {
        return new Signal(symbol, type, price, timestamp, strength, quantity, attributes);
    }

    public Optional<SignalAttribute> attribute(String key) {
        return Optional.ofNullable(attributes.get(key));
    }

    public boolean hasRequestedQuantity() {
        return requestedQuantity != null && requestedQuantity > 0;
    }
}
