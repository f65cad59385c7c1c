package com.annograph.query.permission;

public enum PermissionedType {
    DOCUMENT("documents", true, null),
    CORPUS("corpuses", true, null),
    ANALYSIS("analyses", true, "analyzed_corpus_id"),
    EXTRACT("extracts", false, "corpus_id");

    private final String table;
    private final boolean publicFlag;
    private final String scopeCorpusColumn;

    PermissionedType(String table, boolean publicFlag, String scopeCorpusColumn) {
        this.table = table;
        this.publicFlag = publicFlag;
        this.scopeCorpusColumn = scopeCorpusColumn;
    }

    public String table() {
        return table;
    }

    /**
     * Whether rows of this type carry an {@code is_public} column.
     */
    public boolean hasPublicFlag() {
        return publicFlag;
    }

    /**
     * Column naming the corpus whose read permission visibility also requires, or null.
     */
    public String scopeCorpusColumn() {
        return scopeCorpusColumn;
    }

    public String label() {
        return name().toLowerCase();
    }
}
