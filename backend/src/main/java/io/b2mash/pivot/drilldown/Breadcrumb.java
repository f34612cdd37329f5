package io.b2mash.pivot.drilldown;

import java.util.List;

/**
 * One step of a navigation trail from the root to a header.
 *
 * @param label the dimension key, or "All Data" for the root
 * @param path the path up to and including this step
 * @param current whether this is the last step
 * @param collapsible whether the step is currently expanded
 */
public record Breadcrumb(String label, List<String> path, boolean current, boolean collapsible) {}
