package ai.callflow.model;

/**
 * Text clean-up for labels embedded in flowchart markup.
 */
public final class Labels {

    private Labels() {
    }

    /**
     * Double quotes become single quotes, line breaks become spaces.
     */
    public static String sanitize(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("\r\n", " ")
                .replace('\r', ' ')
                .replace('\n', ' ')
                .replace('"', '\'');
    }

    /**
     * Cuts {@code text} to {@code max} characters, the last three being "...".
     */
    public static String truncate(String text, int max) {
        if (text == null) {
            return "";
        }
        if (max < 4 || text.length() <= max) {
            return text;
        }
        int cut = max - 3;
        if (Character.isHighSurrogate(text.charAt(cut - 1))) {
            cut--;
        }
        return text.substring(0, cut) + "...";
    }
}
