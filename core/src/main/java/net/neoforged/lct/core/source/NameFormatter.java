package net.neoforged.lct.core.source;

import net.neoforged.lct.core.bibliography.CslName;
import org.jetbrains.annotations.Nullable;

import java.util.List;

final class NameFormatter {
    private NameFormatter() {
    }

    /**
     * Full names, e.g. {@code Jane Doe, Jr., John Roe & Ann van Buren}.
     */
    static String longNames(List<CslName> names) {
        var result = new StringBuilder();
        for (int i = 0; i < names.size(); i++) {
            var name = names.get(i);
            if (name.given() != null) {
                result.append(name.given()).append(' ');
            }
            if (name.nonDroppingParticle() != null) {
                result.append(name.nonDroppingParticle()).append(' ');
            }
            var family = family(name);
            if (family != null) {
                result.append(family);
            }
            if (name.suffix() != null) {
                result.append(name.suffix().equals("Jr.") || name.suffix().equals("Sr.") ? ", " : " ");
                result.append(name.suffix());
            }

            if (i < names.size() - 2) {
                result.append(", ");
            } else if (i == names.size() - 2) {
                result.append(" & ");
            }
        }
        return result.toString().strip();
    }

    /**
     * Last names for short cites: one author, two joined by {@code &}, or the first followed by "et al.".
     */
    static String shortNames(List<CslName> names) {
        var result = new StringBuilder(lastName(names.get(0)));
        if (names.size() == 2) {
            result.append(" & ").append(lastName(names.get(1)));
        } else if (names.size() > 2) {
            result.append(" et al.");
        }
        return result.toString();
    }

    private static String lastName(CslName name) {
        var result = new StringBuilder();
        if (name.nonDroppingParticle() != null) {
            result.append(name.nonDroppingParticle()).append(' ');
        }
        var family = family(name);
        if (family != null) {
            result.append(family);
        }
        return result.toString().strip();
    }

    @Nullable
    private static String family(CslName name) {
        return name.family() != null ? name.family() : name.literal();
    }
}
