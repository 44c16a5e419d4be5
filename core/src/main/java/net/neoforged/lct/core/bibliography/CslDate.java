package net.neoforged.lct.core.bibliography;

import com.google.gson.annotations.SerializedName;
import org.jetbrains.annotations.Nullable;

import java.util.List;

public record CslDate(@SerializedName("date-parts") @Nullable List<List<Integer>> dateParts,
                      @Nullable Integer season) {
    public static CslDate ofYear(int year) {
        return new CslDate(List.of(List.of(year)), null);
    }

    /**
     * The year of the first date, or {@code null} if the date has no parts.
     */
    public @Nullable Integer year() {
        if (dateParts == null || dateParts.isEmpty() || dateParts.get(0) == null || dateParts.get(0).isEmpty()) {
            return null;
        }
        return dateParts.get(0).get(0);
    }
}
