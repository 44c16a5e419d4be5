package net.neoforged.lct.core.bibliography;

import com.google.gson.annotations.SerializedName;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * One entry of a CSL-JSON library. Only the fields used for legal citations are read; others are ignored.
 */
public record CslSource(@Nullable String type,
                        String id,
                        @Nullable List<CslName> author,
                        @Nullable List<CslName> editor,
                        @Nullable List<CslName> translator,
                        @Nullable CslDate issued,
                        @SerializedName("container-title") @Nullable String containerTitle,
                        @SerializedName("container-title-short") @Nullable String containerTitleShort,
                        @Nullable String edition,
                        @Nullable String page,
                        @Nullable String title,
                        @SerializedName("title-short") @Nullable String titleShort,
                        @SerializedName("URL") @Nullable String url,
                        @Nullable String volume,
                        @Nullable String authority) {

    public boolean hasAuthors() {
        return author != null && !author.isEmpty();
    }

    public boolean hasEditors() {
        return editor != null && !editor.isEmpty();
    }

    public boolean hasTranslators() {
        return translator != null && !translator.isEmpty();
    }

    public @Nullable Integer year() {
        return issued == null ? null : issued.year();
    }
}
