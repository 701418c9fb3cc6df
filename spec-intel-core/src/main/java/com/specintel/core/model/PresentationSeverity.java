package com.specintel.core.model;

/**
 * Four-level severity scale used by presentation layers.
 *
 * <p>Rules only ever declare {@link Severity}; this scale exists for views that show
 * conflicts as low/medium/high/critical. The mapping is explicit and one-way:
 *
 * <table>
 *   <caption>Rule severity to presentation severity</caption>
 *   <tr><th>Severity</th><th>Presentation</th></tr>
 *   <tr><td>error</td><td>high</td></tr>
 *   <tr><td>warning</td><td>medium</td></tr>
 *   <tr><td>info</td><td>low</td></tr>
 * </table>
 *
 * <p>{@link #CRITICAL} is never produced from a rule severity.
 */
public enum PresentationSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * Maps a rule severity onto the presentation scale.
     *
     * @param severity rule severity
     * @return presentation severity
     */
    public static PresentationSeverity of(Severity severity) {
        return switch (severity) {
            case ERROR -> HIGH;
            case WARNING -> MEDIUM;
            case INFO -> LOW;
        };
    }
}
