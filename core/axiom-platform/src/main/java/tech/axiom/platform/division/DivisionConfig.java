package tech.axiom.platform.division;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration for the division hierarchy.
 *
 * Example configuration:
 * <pre>
 * axiom.divisions.sort-order-step=100
 * </pre>
 */
@ConfigMapping(prefix = "axiom.divisions")
public interface DivisionConfig {

    /**
     * Gap between consecutive sibling sort orders. New divisions are placed one step
     * after the current maximum, and renumbering spaces siblings by one step, leaving
     * room to slot a division between two others without renumbering.
     */
    @WithName("sort-order-step")
    @WithDefault("10")
    int sortOrderStep();
}
