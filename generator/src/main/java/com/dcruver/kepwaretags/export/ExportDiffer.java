package com.dcruver.kepwaretags.export;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Unified diff between a previously exported CSV and a fresh export.
 */
@Component
public class ExportDiffer {

    static final int CONTEXT_LINES = 3;

    /**
     * @return the unified diff, or an empty string when both texts have the same lines
     */
    public String diff(String previous, String current, String fileName) {
        List<String> previousLines = previous.lines().toList();
        List<String> currentLines = current.lines().toList();

        Patch<String> patch = DiffUtils.diff(previousLines, currentLines);
        if (patch.getDeltas().isEmpty()) {
            return "";
        }

        List<String> unifiedDiff = UnifiedDiffUtils.generateUnifiedDiff(
            "exported/" + fileName,
            "current/" + fileName,
            previousLines,
            patch,
            CONTEXT_LINES
        );
        return String.join("\n", unifiedDiff);
    }
}
