package github.sarthakdev143.matte_embed.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

public enum Compression {
    NONE,
    RLE,
    ZIP,
    ZIPS,
    PIZ,
    PXR24,
    B44,
    B44A,
    DWAA;

    public static Compression fromInput(String input) {
        if (input == null || input.isBlank()) {
            return PIZ;
        }

        try {
            return Compression.valueOf(input.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("compression must be one of " + optionList() + ".");
        }
    }

    public String toCodecValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    private static String optionList() {
        return Arrays.stream(values())
                .map(Compression::toCodecValue)
                .collect(Collectors.joining(", "));
    }
}
