package com.dcruver.kepwaretags.config;

import com.dcruver.kepwaretags.domain.DuplicateNamePolicy;
import com.dcruver.kepwaretags.domain.Hierarchy;
import com.dcruver.kepwaretags.export.LineEnding;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Settings bound from the {@code kepware.*} keys of application.yml.
 */
@Component
@ConfigurationProperties(prefix = "kepware")
@Data
public class GeneratorProperties {
    private HierarchySettings hierarchy = new HierarchySettings();
    private ExportSettings export = new ExportSettings();
    private FileSettings files = new FileSettings();

    @Data
    public static class HierarchySettings {
        private String rootName = Hierarchy.DEFAULT_ROOT_NAME;
        private DuplicateNamePolicy duplicateNames = DuplicateNamePolicy.ALLOW;
    }

    @Data
    public static class ExportSettings {
        private String csvFile = "kepware_tags.csv";
        private LineEnding lineEnding = LineEnding.CRLF;
    }

    @Data
    public static class FileSettings {
        private String jsonFile = "kepware_hierarchy.json";
        private boolean backupOnOverwrite = true;
    }
}
