package io.github.cyfko.formulalint.core.validation;

/**
 * Caller-supplied context of a validation run.
 *
 * @param allowXParameter whether {@code x}/{@code X} may stand for a numeric argument, which is
 *                        only the case inside a global formula definition
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ValidationOptions(boolean allowXParameter) {

    public static ValidationOptions defaults() {
        return new ValidationOptions(false);
    }

    public static ValidationOptions allowingX() {
        return new ValidationOptions(true);
    }
}
