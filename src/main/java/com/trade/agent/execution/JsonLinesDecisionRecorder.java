package com.trade.agent.execution;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.trade.agent.core.JsonSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON Lines 决策记录实现：每个批次一行
 */
public class JsonLinesDecisionRecorder implements DecisionRecorder {

    private static final Logger logger = LoggerFactory.getLogger(JsonLinesDecisionRecorder.class);

    private final Path filePath;
    private final ObjectMapper objectMapper;

    public JsonLinesDecisionRecorder(Path filePath) {
        this.filePath = filePath;
        this.objectMapper = JsonSupport.newObjectMapper();
        try {
            Path parent = filePath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("创建决策记录目录失败: " + filePath, e);
        }
    }

    @Override
    public synchronized void record(DecisionBatch batch) {
        try {
            String line = objectMapper.writeValueAsString(batch) + System.lineSeparator();
            Files.writeString(filePath, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            logger.debug("决策批次已记录: {}", batch.getBatchId());
        } catch (IOException e) {
            throw new UncheckedIOException("写入决策记录失败: " + filePath, e);
        }
    }

    @Override
    public synchronized List<DecisionBatch> readRecent(int limit) {
        if (!Files.exists(filePath)) {
            return List.of();
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(filePath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("读取决策记录失败: " + filePath, e);
        }
        List<DecisionBatch> batches = new ArrayList<>();
        for (int i = Math.max(0, lines.size() - limit); i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            try {
                batches.add(objectMapper.readValue(line, DecisionBatch.class));
            } catch (IOException e) {
                logger.warn("跳过无法解析的决策记录行 {}: {}", i + 1, e.getMessage());
            }
        }
        return batches;
    }
}
