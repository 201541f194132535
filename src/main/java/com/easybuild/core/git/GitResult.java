package com.easybuild.core.git;

/**
 * Uniform outcome of a single git invocation.
 *
 * @param success  whether the operation counts as successful (pull treats some
 *                 non-zero exits as success)
 * @param exitCode process exit code, {@code -1} when the process did not finish
 * @param output   captured stdout
 * @param detail   stderr or a description of what went wrong; empty on a clean run
 * @param timedOut whether the process was killed for exceeding its timeout
 */
public record GitResult(
    boolean success,
    int exitCode,
    String output,
    String detail,
    boolean timedOut
) {

    public static GitResult ok(String output) {
        return new GitResult(true, 0, output, "", false);
    }

    public static GitResult failed(int exitCode, String detail) {
        return new GitResult(false, exitCode, "", detail, false);
    }

    public static GitResult timedOut(String detail) {
        return new GitResult(false, -1, "", detail, true);
    }

    /**
     * Copy of this result that counts as a success, keeping the original detail as a warning.
     */
    public GitResult asWarning() {
        return new GitResult(true, exitCode, output, detail, false);
    }
}
