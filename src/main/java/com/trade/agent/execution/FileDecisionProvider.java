package com.trade.agent.execution;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trade.agent.core.JsonSupport;
import com.trade.agent.core.Symbols;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 从收件箱文件读取决策：{ "BTCUSDT": {"action": "OPEN_LONG", ...}, ... }
 * 读取后文件被改名为 *.consumed-时间戳，避免重复执行；无法解析的文件改名为 *.rejected-时间戳
 */
public class FileDecisionProvider implements DecisionProvider {

    private static final Logger logger = LoggerFactory.getLogger(FileDecisionProvider.class);
    private static final DateTimeFormatter SUFFIX_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMddHHmmssSSS").withZone(ZoneOffset.UTC);

    private final Path inboxFile;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public FileDecisionProvider(Path inboxFile) {
        this(inboxFile, Clock.systemUTC());
    }

    public FileDecisionProvider(Path inboxFile, Clock clock) {
        this.inboxFile = inboxFile;
        this.objectMapper = JsonSupport.newObjectMapper();
        this.clock = clock;
    }

    @Override
    public DecisionBatch nextBatch(List<String> symbols) {
        if (!Files.exists(inboxFile)) {
            logger.debug("没有待执行的决策文件: {}", inboxFile);
            return new DecisionBatch(Map.of());
        }
        Map<String, Decision> raw;
        try {
            raw = objectMapper.readValue(inboxFile.toFile(), new TypeReference<LinkedHashMap<String, Decision>>() {});
        } catch (JsonProcessingException e) {
            // 格式错误的文件移走，否则之后每个周期都会在这里失败
            Path rejected = moveAside(".rejected-");
            logger.error("决策文件格式错误，已移至 {}: {}", rejected, e.getOriginalMessage());
            return new DecisionBatch(Map.of());
        } catch (IOException e) {
            throw new UncheckedIOException("读取决策文件失败: " + inboxFile, e);
        }
        moveAside(".consumed-");

        Map<String, Decision> accepted = new LinkedHashMap<>();
        for (Map.Entry<String, Decision> entry : raw.entrySet()) {
            boolean watched = symbols.isEmpty()
                    || symbols.stream().anyMatch(s -> Symbols.sameInstrument(s, entry.getKey()));
            if (!watched) {
                logger.warn("忽略未配置标的的决策: {}", entry.getKey());
                continue;
            }
            Decision decision = entry.getValue();
            if (decision == null) {
                logger.warn("忽略空决策: {}", entry.getKey());
                continue;
            }
            if (decision.getExecutionStatus() != ExecutionStatus.PENDING || decision.getExecutionResult() != null) {
                logger.warn("{} 的决策带有执行状态 {}，已重置为待执行", entry.getKey(), decision.getExecutionStatus());
                decision.resetExecution();
            }
            decision.setSymbol(entry.getKey());
            accepted.put(entry.getKey(), decision);
        }
        logger.info("读取决策 {} 条（文件 {}）", accepted.size(), inboxFile);
        return new DecisionBatch(accepted);
    }

    private Path moveAside(String suffix) {
        Path target = inboxFile.resolveSibling(inboxFile.getFileName() + suffix
                + SUFFIX_FORMAT.format(clock.instant()));
        try {
            Files.move(inboxFile, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("移动决策文件失败: " + inboxFile, e);
        }
        return target;
    }
}
