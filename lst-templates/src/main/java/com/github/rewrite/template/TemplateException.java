package com.github.rewrite.template;

/**
 * Exception thrown when a template cannot be rendered.
 * <p>
 * The components of the rendering pipeline raise it; the entry points in {@link LstTemplates}
 * turn it into a failed {@link TemplateResult}. {@link TemplateResult#orElseThrow()} raises it
 * again for callers that prefer exceptions.
 *
 * @see TemplateError.Kind
 */
public class TemplateException extends RuntimeException {

    private final TemplateError error;

    /**
     * Creates a new TemplateException for the given error.
     *
     * @param error the error describing the failure
     */
    public TemplateException(TemplateError error) {
        super(error.getMessage());
        this.error = error;
    }

    /**
     * Creates a new TemplateException for the given error and cause.
     *
     * @param error the error describing the failure
     * @param cause the cause of this exception
     */
    public TemplateException(TemplateError error, Throwable cause) {
        super(error.getMessage(), cause);
        this.error = error;
    }

    public TemplateError getError() {
        return error;
    }

    public TemplateError.Kind getKind() {
        return error.getKind();
    }
}
