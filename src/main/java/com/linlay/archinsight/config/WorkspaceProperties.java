package com.linlay.archinsight.config;

import com.linlay.archinsight.workspace.LocalWorkspaceFileAccess;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashSet;
import java.util.Set;

@Validated
@ConfigurationProperties(prefix = "insight.workspace")
public class WorkspaceProperties {

    @NotBlank
    private String root = System.getProperty("user.dir", ".");
    private Set<String> skippedDirectories = new LinkedHashSet<>(LocalWorkspaceFileAccess.DEFAULT_SKIPPED_DIRECTORIES);

    public String getRoot() {
        return root;
    }

    public void setRoot(String root) {
        this.root = root;
    }

    public Set<String> getSkippedDirectories() {
        return skippedDirectories;
    }

    public void setSkippedDirectories(Set<String> skippedDirectories) {
        this.skippedDirectories = skippedDirectories == null
                ? new LinkedHashSet<>()
                : new LinkedHashSet<>(skippedDirectories);
    }
}
