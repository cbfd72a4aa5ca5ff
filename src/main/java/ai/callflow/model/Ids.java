package ai.callflow.model;

import java.util.Objects;

public final class Ids {

    private Ids() {
    }

    public static String nodeId(int sequence) {
        return "N" + sequence;
    }

    /** Click target understood by the diagram viewer's jump-to-source handler. */
    public static String offsetTarget(int offset) {
        return "offset-" + offset;
    }

    /**
     * Service name of a call receiver: the text before the first '.',
     * or the whole receiver when it has none.
     */
    public static String receiverPrefix(String receiver) {
        if (receiver == null) {
            return "";
        }
        final String raw = receiver.trim();
        final int dot = raw.indexOf('.');
        return dot >= 0 ? raw.substring(0, dot) : raw;
    }

    public static boolean isSelfReference(String receiver) {
        return "this".equals(Objects.requireNonNullElse(receiver, "").trim());
    }
}
