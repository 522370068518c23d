package github.sarthakdev143.uniq_publisher.integration.video;

/**
 * Exit status and captured streams of one external process run.
 */
public record CommandResult(int exitCode, String output, String errorOutput, boolean timedOut) {

    private static final int TAIL_CHARS = 2000;

    public boolean isSuccess() {
        return !timedOut && exitCode == 0;
    }

    /**
     * Last part of stderr, short enough to put in an exception message.
     */
    public String errorTail() {
        if (errorOutput == null) {
            return "";
        }
        String trimmed = errorOutput.strip();
        if (trimmed.length() <= TAIL_CHARS) {
            return trimmed;
        }
        return "..." + trimmed.substring(trimmed.length() - TAIL_CHARS);
    }
}
