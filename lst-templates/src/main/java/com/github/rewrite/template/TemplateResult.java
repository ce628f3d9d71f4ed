package com.github.rewrite.template;

import org.jspecify.annotations.Nullable;

import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of rendering a template: either the rendered tree or the {@link TemplateError} that
 * stopped the pipeline. There is no partial result.
 * <p>
 * Usage:
 * <pre>
 * Expression call = LstTemplates.expression("{target}.close()", Map.of("target", field))
 *         .fold(e -&gt; e, error -&gt; fallback(error.getKind()));
 * </pre>
 *
 * @param <T> the kind of tree the entry point promises
 */
public final class TemplateResult<T> {

    @Nullable
    private final T value;

    @Nullable
    private final TemplateError error;

    private TemplateResult(@Nullable T value, @Nullable TemplateError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> TemplateResult<T> success(T value) {
        return new TemplateResult<>(value, null);
    }

    public static <T> TemplateResult<T> failure(TemplateError error) {
        return new TemplateResult<>(null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public Optional<T> getValue() {
        return Optional.ofNullable(value);
    }

    public Optional<TemplateError> getError() {
        return Optional.ofNullable(error);
    }

    /**
     * Returns the rendered tree or throws the failure as a {@link TemplateException}.
     */
    public T orElseThrow() {
        if (error != null) {
            throw new TemplateException(error);
        }
        //noinspection DataFlowIssue
        return value;
    }

    public <R> R fold(Function<? super T, ? extends R> onSuccess,
                      Function<? super TemplateError, ? extends R> onFailure) {
        if (error != null) {
            return onFailure.apply(error);
        }
        //noinspection DataFlowIssue
        return onSuccess.apply(value);
    }

    @Override
    public String toString() {
        return error != null ? "TemplateResult[" + error + "]" : "TemplateResult[" + value + "]";
    }
}
