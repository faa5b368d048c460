package work.lcod.texstack.error;

/**
 * Failure kinds raised while reducing the parse stack, with their message templates.
 */
public enum TexErrorKind {
    EXTRA_OPEN_MISSING_CLOSE("ExtraOpenMissingClose", "Extra open brace or missing close brace"),
    EXTRA_CLOSE_MISSING_OPEN("ExtraCloseMissingOpen", "Extra close brace or missing open brace"),
    MISSING_LEFT_EXTRA_RIGHT("MissingLeftExtraRight", "Missing \\left or extra \\right"),
    EXTRA_LEFT_MISSING_RIGHT("ExtraLeftMissingRight", "Extra \\left or missing \\right"),
    ENV_BAD_END("EnvBadEnd", "\\begin{%1} ended with \\end{%2}"),
    ENV_MISSING_END("EnvMissingEnd", "Missing \\end{%1}"),
    MISSING_SCRIPT("MissingScript", "Missing superscript or subscript argument"),
    MISSING_OPEN_FOR_SUB("MissingOpenForSub", "Missing open brace for subscript"),
    MISSING_OPEN_FOR_SUP("MissingOpenForSup", "Missing open brace for superscript"),
    AMBIGUOUS_USE_OF("AmbiguousUseOf", "Ambiguous use of %1"),
    MISPLACED("Misplaced", "Misplaced %1"),
    MISSING_BOX_FOR("MissingBoxFor", "Missing box for %1"),
    MISSING_CLOSE_BRACE("MissingCloseBrace", "Missing close brace");

    private final String key;
    private final String template;

    TexErrorKind(String key, String template) {
        this.key = key;
        this.template = template;
    }

    public String key() {
        return key;
    }

    public String template() {
        return template;
    }

    public TexError error(Object... args) {
        return new TexError(this, args);
    }
}
