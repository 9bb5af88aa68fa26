package org.nowstart.tradelab.runner;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.RequiredArgsConstructor;
import org.nowstart.tradelab.data.dto.BacktestResult;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class BacktestReportWriter {

    private final ObjectMapper objectMapper;

    public void write(BacktestResult result, Path path) {
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            objectMapper.writerWithDefaultPrettyPrinter()
                    .without(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                    .writeValue(path.toFile(), result);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write backtest report: " + path, e);
        }
    }
}
