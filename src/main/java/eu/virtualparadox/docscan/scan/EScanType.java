package eu.virtualparadox.docscan.scan;

public enum EScanType {
    KEYWORD("Keyword"),
    SIMILARITY("Similarity");

    private final String label;

    EScanType(final String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
