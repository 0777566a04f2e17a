package org.mtgl.grammar;

/**
 * A grammar lookup failed: a keyword with no template, a malformed template
 * table, or a keyword clause whose parameters do not fit its template.
 * Fatal for the document being processed.
 */
public class CatalogException extends Exception {

    private static final long serialVersionUID = 1L;

    String document;

    public CatalogException(String message) {
        super(message);
    }

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }

    public String getDocument() {
        return document;
    }

    public CatalogException setDocument(String document) {
        if (this.document==null)
            this.document = document;
        return this;
    }

    @Override
    public String getMessage() {
        return document==null?super.getMessage():document+": "+super.getMessage();
    }
}
