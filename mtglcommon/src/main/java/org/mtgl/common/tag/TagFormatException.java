package org.mtgl.common.tag;

/**
 * Raised when text that should be in tag notation is not.
 */
public class TagFormatException extends Exception {

    private static final long serialVersionUID = 1L;

    String text;

    public TagFormatException(String text) {
        super("malformed tag: "+text);
        this.text = text;
    }

    public TagFormatException(String text, String message) {
        super(message+": "+text);
        this.text = text;
    }

    public String getText() {
        return text;
    }
}
