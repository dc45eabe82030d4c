package github.sarthakdev143.matte_embed.service.impl;

import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Parses frame identifiers out of image filenames.
 * <p>
 * Identifiers are compared as strings, so {@code shot.0100.exr} and {@code shot.100.exr}
 * never pair up: zero padding has to agree between a base sequence and its mattes.
 */
@Component
public class FrameIndexer {

    public static final String IMAGE_EXTENSION = ".exr";

    private static final Pattern TRAILING_FRAME_PATTERN =
            Pattern.compile("(\\d{4,})\\.exr$", Pattern.CASE_INSENSITIVE);
    private static final Pattern ANY_FRAME_PATTERN = Pattern.compile("\\d{4,}");
    private static final Pattern DIGITS_PATTERN = Pattern.compile("\\d+");

    private final Comparator<String> identifierOrder = this::compareIdentifiers;
    private final Comparator<String> frameOrder = Comparator
            .comparing(this::frameId, identifierOrder)
            .thenComparing(Comparator.naturalOrder());

    public String frameId(String filename) {
        Matcher trailing = TRAILING_FRAME_PATTERN.matcher(filename);
        if (trailing.find()) {
            return trailing.group(1);
        }

        String stem = stripExtension(filename);
        Matcher anywhere = ANY_FRAME_PATTERN.matcher(stem);
        String lastRun = null;
        while (anywhere.find()) {
            lastRun = anywhere.group();
        }
        return lastRun != null ? lastRun : stem;
    }

    public Stream<String> frameIds(List<String> filenames) {
        return filenames.stream().map(this::frameId);
    }

    public boolean isImageFile(String filename) {
        return filename.toLowerCase(Locale.ROOT).endsWith(IMAGE_EXTENSION);
    }

    public Comparator<String> frameOrder() {
        return frameOrder;
    }

    public Comparator<String> identifierOrder() {
        return identifierOrder;
    }

    private int compareIdentifiers(String left, String right) {
        boolean leftNumeric = DIGITS_PATTERN.matcher(left).matches();
        boolean rightNumeric = DIGITS_PATTERN.matcher(right).matches();
        if (leftNumeric && rightNumeric) {
            String leftValue = stripLeadingZeros(left);
            String rightValue = stripLeadingZeros(right);
            int byMagnitude = Integer.compare(leftValue.length(), rightValue.length());
            if (byMagnitude != 0) {
                return byMagnitude;
            }
            int byValue = leftValue.compareTo(rightValue);
            if (byValue != 0) {
                return byValue;
            }
        } else if (leftNumeric != rightNumeric) {
            return leftNumeric ? -1 : 1;
        }
        return left.compareTo(right);
    }

    private String stripLeadingZeros(String digits) {
        int index = 0;
        while (index < digits.length() - 1 && digits.charAt(index) == '0') {
            index++;
        }
        return digits.substring(index);
    }

    private String stripExtension(String filename) {
        int dot = filename.lastIndexOf('.');
        return dot > 0 ? filename.substring(0, dot) : filename;
    }
}
