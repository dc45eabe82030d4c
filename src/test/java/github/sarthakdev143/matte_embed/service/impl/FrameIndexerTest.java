package github.sarthakdev143.matte_embed.service.impl;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class FrameIndexerTest {

    private final FrameIndexer frameIndexer = new FrameIndexer();

    @Test
    void frameIdUsesDigitsImmediatelyBeforeExtension() {
        assertThat(frameIndexer.frameId("shot.1001.exr")).isEqualTo("1001");
        assertThat(frameIndexer.frameId("shot_v002_1001.EXR")).isEqualTo("1001");
        assertThat(frameIndexer.frameId("plate.00012345.exr")).isEqualTo("00012345");
    }

    @Test
    void frameIdFallsBackToAnyFourDigitRun() {
        assertThat(frameIndexer.frameId("shot_1001_beauty.exr")).isEqualTo("1001");
        assertThat(frameIndexer.frameId("2024_shot_1001_v2.exr")).isEqualTo("1001");
    }

    @Test
    void frameIdFallsBackToStemWhenNoFrameNumber() {
        assertThat(frameIndexer.frameId("hero.exr")).isEqualTo("hero");
        assertThat(frameIndexer.frameId("shot.101.exr")).isEqualTo("shot.101");
    }

    @Test
    void zeroPaddingDifferencesNeverMatch() {
        assertThat(frameIndexer.frameId("shot.0100.exr")).isEqualTo("0100");
        assertThat(frameIndexer.frameId("shot.100.exr")).isNotEqualTo(frameIndexer.frameId("shot.0100.exr"));
        assertThat(frameIndexer.frameId("shot.01000.exr")).isNotEqualTo(frameIndexer.frameId("shot.1000.exr"));
    }

    @Test
    void frameIdsIsRestartable() {
        List<String> filenames = List.of("a.1001.exr", "a.1002.exr");

        Stream<String> first = frameIndexer.frameIds(filenames);
        Stream<String> second = frameIndexer.frameIds(filenames);

        assertThat(first.collect(Collectors.toList())).containsExactly("1001", "1002");
        assertThat(second.collect(Collectors.toList())).containsExactly("1001", "1002");
    }

    @Test
    void frameOrderSortsByParsedIdentifierRatherThanFilename() {
        List<String> filenames = new ArrayList<>(List.of(
                "b_shot.1002.exr",
                "a_shot.1010.exr",
                "c_shot.0999.exr",
                "z_shot.1001.exr"));

        filenames.sort(frameIndexer.frameOrder());

        assertThat(filenames).containsExactly(
                "c_shot.0999.exr",
                "z_shot.1001.exr",
                "b_shot.1002.exr",
                "a_shot.1010.exr");
    }

    @Test
    void frameOrderPlacesNumericFramesBeforeUnnumberedFiles() {
        List<String> filenames = new ArrayList<>(List.of("hero.exr", "shot.10000.exr", "shot.9999.exr"));

        filenames.sort(frameIndexer.frameOrder());

        assertThat(filenames).containsExactly("shot.9999.exr", "shot.10000.exr", "hero.exr");
    }

    @Test
    void isImageFileRecognisesExrCaseInsensitively() {
        assertThat(frameIndexer.isImageFile("a.1001.exr")).isTrue();
        assertThat(frameIndexer.isImageFile("a.1001.EXR")).isTrue();
        assertThat(frameIndexer.isImageFile("a.1001.png")).isFalse();
        assertThat(frameIndexer.isImageFile("notes.txt")).isFalse();
    }
}
