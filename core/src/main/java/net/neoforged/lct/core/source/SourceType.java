package net.neoforged.lct.core.source;

import org.jetbrains.annotations.Nullable;

/**
 * The kinds of library entries that can be cited, with their CSL type names.
 */
public enum SourceType {
    BOOK("book"),
    CHAPTER("chapter"),
    ARTICLE("article-journal"),
    MANUSCRIPT("manuscript"),
    CASE("legal_case");

    private final String cslName;

    SourceType(String cslName) {
        this.cslName = cslName;
    }

    public static @Nullable SourceType byCslName(String cslName) {
        for (var type : values()) {
            if (type.cslName.equals(cslName)) {
                return type;
            }
        }
        return null;
    }
}
