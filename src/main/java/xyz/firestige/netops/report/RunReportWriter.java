package xyz.firestige.netops.report;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * 把运行报告序列化为 JSON，供通知/CI 工具读取
 */
public class RunReportWriter {

    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    public String toJson(RunReport report) {
        try {
            return mapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("序列化运行报告失败: " + report.getRunId(), e);
        }
    }

    /**
     * 写入 {@code <directory>/<runId>.json}
     */
    public Path write(RunReport report, Path directory) {
        Path target = directory.resolve(report.getRunId() + ".json");
        try {
            Files.createDirectories(directory);
            Files.writeString(target, toJson(report));
        } catch (IOException e) {
            throw new UncheckedIOException("写入运行报告失败: " + target, e);
        }
        return target;
    }
}
