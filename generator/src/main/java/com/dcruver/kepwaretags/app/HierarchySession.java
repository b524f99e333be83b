package com.dcruver.kepwaretags.app;

import com.dcruver.kepwaretags.config.GeneratorProperties;
import com.dcruver.kepwaretags.domain.Hierarchy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Holds the one hierarchy the shell session edits.
 */
@Component
@Slf4j
public class HierarchySession {

    private final GeneratorProperties properties;
    private Hierarchy current;

    public HierarchySession(GeneratorProperties properties) {
        this.properties = properties;
        this.current = emptyHierarchy();
    }

    public Hierarchy current() {
        return current;
    }

    /**
     * Discard the current hierarchy and start over with an empty root.
     */
    public Hierarchy reset() {
        current = emptyHierarchy();
        log.info("Started a new hierarchy");
        return current;
    }

    /**
     * Swap in a fully built hierarchy, e.g. one just loaded from disk.
     */
    public void replace(Hierarchy hierarchy) {
        hierarchy.setDuplicateNamePolicy(properties.getHierarchy().getDuplicateNames());
        current = hierarchy;
    }

    private Hierarchy emptyHierarchy() {
        return new Hierarchy(
            properties.getHierarchy().getRootName(),
            properties.getHierarchy().getDuplicateNames());
    }
}
