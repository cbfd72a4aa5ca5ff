package ai.callflow.render;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import ai.callflow.model.FlowStep;
import ai.callflow.model.Ids;

/**
 * Render-time settings. Filters only hide external calls; the analysis
 * result itself is never changed.
 */
public record RenderOptions(
        Set<String> ignoredVariableNames,
        Set<String> ignoredServiceNames,
        boolean collapseDetails,
        boolean showSourceReference
) {
    public static final List<String> DEFAULT_IGNORED_SERVICES = List.of("System.out", "System.err");

    public RenderOptions {
        ignoredVariableNames = normalize(ignoredVariableNames);
        ignoredServiceNames = normalize(ignoredServiceNames);
    }

    /** No filters, full detail, no line references. */
    public static RenderOptions none() {
        return new RenderOptions(Set.of(), Set.of(), false, false);
    }

    /** Console output ({@code System.out}, {@code System.err}) hidden. */
    public static RenderOptions defaults() {
        return none().withIgnoredServices(DEFAULT_IGNORED_SERVICES);
    }

    public RenderOptions withIgnoredVariables(Collection<String> names) {
        return new RenderOptions(merge(ignoredVariableNames, names), ignoredServiceNames,
                collapseDetails, showSourceReference);
    }

    public RenderOptions withIgnoredServices(Collection<String> names) {
        return new RenderOptions(ignoredVariableNames, merge(ignoredServiceNames, names),
                collapseDetails, showSourceReference);
    }

    public RenderOptions withCollapseDetails(boolean collapse) {
        return new RenderOptions(ignoredVariableNames, ignoredServiceNames, collapse, showSourceReference);
    }

    public RenderOptions withSourceReference(boolean show) {
        return new RenderOptions(ignoredVariableNames, ignoredServiceNames, collapseDetails, show);
    }

    /**
     * Whether an external call is hidden by the ignore lists. A service entry
     * matches the receiver, its first segment, or a prefix of the call text
     * ("System.out" hides {@code System.out.println(..)}); a variable entry
     * matches the receiver or a receiver starting with it.
     */
    public boolean ignores(FlowStep.Call call) {
        if (!call.external() || call.receiver().isEmpty()) {
            return false;
        }
        final String receiver = call.receiver();
        final String prefix = Ids.receiverPrefix(receiver);
        for (String service : ignoredServiceNames) {
            if (receiver.equals(service)
                    || prefix.equals(service)
                    || call.rawText().startsWith(service + ".")) {
                return true;
            }
        }
        for (String variable : ignoredVariableNames) {
            if (receiver.equals(variable) || receiver.startsWith(variable + ".")) {
                return true;
            }
        }
        return false;
    }

    private static Set<String> normalize(Collection<String> names) {
        final Set<String> result = new LinkedHashSet<>();
        if (names != null) {
            for (String n : names) {
                if (n != null && !n.isBlank()) {
                    result.add(n.trim());
                }
            }
        }
        return Collections.unmodifiableSet(result);
    }

    private static Set<String> merge(Set<String> current, Collection<String> more) {
        final Set<String> merged = new LinkedHashSet<>(current);
        if (more != null) {
            merged.addAll(more);
        }
        return merged;
    }
}
