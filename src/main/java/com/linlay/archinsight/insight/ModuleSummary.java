package com.linlay.archinsight.insight;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Rollup of the file summaries under one directory.
 *
 * @param module     directory path relative to the workspace root
 * @param moduleType caller-supplied kind, for example {@code api}, {@code cli} or {@code core}
 */
public record ModuleSummary(
        String module,
        String moduleType,
        List<String> capabilities,
        String summary,
        List<FileSummary> files,
        List<Endpoint> endpoints,
        List<Command> commands,
        List<Worker> workers
) {

    public static final String FAILED_SUMMARY = "Module analysis failed";

    public ModuleSummary {
        module = module == null ? "" : module;
        moduleType = moduleType == null ? "" : moduleType;
        capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
        summary = summary == null ? "" : summary;
        files = files == null ? List.of() : List.copyOf(files);
        endpoints = endpoints == null ? List.of() : List.copyOf(endpoints);
        commands = commands == null ? List.of() : List.copyOf(commands);
        workers = workers == null ? List.of() : List.copyOf(workers);
    }

    public static ModuleSummary failed(String module, String moduleType, List<FileSummary> files) {
        return new ModuleSummary(module, moduleType, List.of(), FAILED_SUMMARY, files, null, null, null);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Endpoint(String path, String method, String description) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Command(String command, String description) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Worker(String name, String description, String jobFlow) {
    }
}
