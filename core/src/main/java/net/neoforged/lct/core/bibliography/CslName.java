package net.neoforged.lct.core.bibliography;

import com.google.gson.annotations.SerializedName;
import org.jetbrains.annotations.Nullable;

/**
 * A CSL name variable. {@code literal} holds institutional names that have no family/given split.
 */
public record CslName(@Nullable String family,
                      @Nullable String given,
                      @SerializedName("non-dropping-particle") @Nullable String nonDroppingParticle,
                      @Nullable String suffix,
                      @Nullable String literal) {
    public static CslName of(String given, String family) {
        return new CslName(family, given, null, null, null);
    }
}
