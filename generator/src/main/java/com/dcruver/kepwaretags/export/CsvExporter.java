package com.dcruver.kepwaretags.export;

import com.dcruver.kepwaretags.config.GeneratorProperties;
import com.dcruver.kepwaretags.domain.HierarchyAuditor;
import com.dcruver.kepwaretags.domain.TagRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Renders flattened tags in the Kepware tag-import CSV layout.
 *
 * Fields are written unquoted, as the import format expects; names with commas,
 * quotes or line breaks are logged because they will corrupt their row.
 */
@Component
@Slf4j
public class CsvExporter {

    public static final String HEADER = "Tag Name,Address,Data Type,Respect Data Type,Client Access,Scan Rate,"
        + "Scaling,Raw Low,Raw High,Scaled Low,Scaled High,Scaled Data Type,Clamp Low,Clamp High,Eng Units,"
        + "Description,Negate Value";

    // Respect Data Type, Client Access, Scan Rate, then eleven empty columns
    static final String FIXED_COLUMNS = ",1,R/W,100,,,,,,,,,,,";

    private final LineEnding lineEnding;

    public CsvExporter() {
        this(LineEnding.CRLF);
    }

    public CsvExporter(LineEnding lineEnding) {
        this.lineEnding = lineEnding;
    }

    @Autowired
    public CsvExporter(GeneratorProperties properties) {
        this(properties.getExport().getLineEnding());
    }

    /**
     * Build the CSV text, allocating addresses in list order.
     *
     * @throws NoTagsException if {@code tags} is empty
     */
    public String export(List<TagRecord> tags) {
        if (tags == null || tags.isEmpty()) {
            throw new NoTagsException();
        }

        String newline = lineEnding.getSeparator();
        AddressAllocator allocator = new AddressAllocator();
        StringBuilder sb = new StringBuilder();
        sb.append(HEADER).append(newline);

        for (TagRecord tag : tags) {
            if (HierarchyAuditor.hasUnsafeCsvCharacters(tag.getFullName())) {
                log.warn("Tag name '{}' contains characters the CSV cannot escape", tag.getFullName());
            }
            sb.append(tag.getFullName())
                .append(',')
                .append(allocator.next(tag.getDataType()))
                .append(',')
                .append(tag.getDataType().getCsvName())
                .append(FIXED_COLUMNS)
                .append(newline);
        }

        log.debug("Rendered {} tag rows", tags.size());
        return sb.toString();
    }
}
