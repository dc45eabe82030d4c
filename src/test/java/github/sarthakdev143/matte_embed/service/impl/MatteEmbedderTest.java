package github.sarthakdev143.matte_embed.service.impl;

import github.sarthakdev143.matte_embed.model.Compression;
import github.sarthakdev143.matte_embed.model.EmbedTask;
import github.sarthakdev143.matte_embed.model.image.ImageHandle;
import github.sarthakdev143.matte_embed.model.image.ImageHeader;
import github.sarthakdev143.matte_embed.model.image.PixelBuffer;
import github.sarthakdev143.matte_embed.model.image.PixelType;
import github.sarthakdev143.matte_embed.support.FakeImageCodec;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static github.sarthakdev143.matte_embed.support.SequenceFixtures.baseSequence;
import static github.sarthakdev143.matte_embed.support.SequenceFixtures.matteSequence;
import static github.sarthakdev143.matte_embed.support.SequenceFixtures.sequence;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class MatteEmbedderTest {

    @TempDir
    Path root;

    private final FakeImageCodec imageCodec = spy(new FakeImageCodec());
    private final MatteEmbedder embedder = new MatteEmbedder(imageCodec, new ChannelNameResolver());

    @Test
    void writesBaseChannelsFollowedByMatteChannels() throws Exception {
        Path base = baseSequence(root, "Seq", "Seq.1001.exr");
        Path matteR = matteSequence(root, "Seq_matteR", "r.1001.exr");
        Path matteDepth = matteSequence(root, "Seq_matteDepth", "d.1001.exr");
        EmbedTask task = task(base, Map.of("r", matteR, "depth", matteDepth),
                Map.of("r", "r.1001.exr", "depth", "d.1001.exr"),
                Map.of("r", "matte.matte_r", "depth", "matte.depth"),
                Compression.PIZ);

        embedder.embed(task);

        Path output = root.resolve("Seq_embedded").resolve("Seq.1001.exr");
        assertThat(output).exists();
        assertThat(FakeImageCodec.writtenChannels(output))
                .startsWith("R", "G", "B", "A")
                .contains("matte.matte_r", "matte.depth")
                .hasSize(6);
        assertThat(imageCodec.openHandles()).isZero();
    }

    @Test
    void dropsWriterAndSetsRequestedCompression() throws Exception {
        Path base = baseSequence(root, "Seq", "Seq.1001.exr");
        Path matte = matteSequence(root, "Seq_matte", "m.1001.exr");

        embedder.embed(singleChannelTask(base, matte, Compression.DWAA));

        ArgumentCaptor<ImageHeader> header = ArgumentCaptor.forClass(ImageHeader.class);
        verify(imageCodec).write(any(Path.class), header.capture(), anyMap());
        assertThat(header.getValue().attributes())
                .doesNotContainKey(MatteEmbedder.WRITER_ATTRIBUTE)
                .containsEntry(MatteEmbedder.COMPRESSION_ATTRIBUTE, "dwaa")
                .containsEntry("owner", "fixtures");
        assertThat(header.getValue().channelNames()).containsExactly("R", "G", "B", "A", "matte");
    }

    @Test
    @SuppressWarnings("unchecked")
    void readsEveryChannelAsHalf() throws Exception {
        Path base = baseSequence(root, "Seq", "Seq.1001.exr");
        Path matte = matteSequence(root, "Seq_matte", "m.1001.exr");

        embedder.embed(singleChannelTask(base, matte, Compression.PIZ));

        ArgumentCaptor<Map<String, PixelBuffer>> channels = ArgumentCaptor.forClass(Map.class);
        verify(imageCodec).write(any(Path.class), any(ImageHeader.class), channels.capture());
        assertThat(channels.getValue().values()).extracting(PixelBuffer::pixelType).containsOnly(PixelType.HALF);
        assertThat(channels.getValue().get("matte").channelName()).isEqualTo("R");
        assertThat(channels.getValue().get("matte").source().path()).isEqualTo(matte.resolve("m.1001.exr"));
    }

    @Test
    void reEmbeddingReplacesPreviousMatteChannels() throws Exception {
        Path base = sequence(root, "Seq", "R,G,B,A,matte,matte.matte_r,matteness", "Seq.1001.exr");
        Path matte = matteSequence(root, "Seq_matte", "m.1001.exr");

        embedder.embed(singleChannelTask(base, matte, Compression.PIZ));

        assertThat(FakeImageCodec.writtenChannels(root.resolve("Seq_embedded").resolve("Seq.1001.exr")))
                .containsExactly("R", "G", "B", "A", "matteness", "matte");
    }

    @Test
    void singleChannelMatteWithoutRIsAccepted() throws Exception {
        Path base = baseSequence(root, "Seq", "Seq.1001.exr");
        Path matte = sequence(root, "Seq_matte", "Y", "m.1001.exr");

        embedder.embed(singleChannelTask(base, matte, Compression.PIZ));

        assertThat(FakeImageCodec.writtenChannels(root.resolve("Seq_embedded").resolve("Seq.1001.exr")))
                .endsWith("matte");
    }

    @Test
    void matteWithoutUsableChannelFailsWithChannelContext() throws Exception {
        Path base = baseSequence(root, "Seq", "Seq.1001.exr");
        Path matte = sequence(root, "Seq_matte", "X,Y", "m.1001.exr");

        assertThatThrownBy(() -> embedder.embed(singleChannelTask(base, matte, Compression.PIZ)))
                .isInstanceOf(IOException.class)
                .hasMessageStartingWith("Error processing matte channel base:")
                .hasMessageContaining("no R channel");
        assertThat(imageCodec.openHandles()).isZero();
    }

    @Test
    void unreadableBaseFailsBeforeOpeningMattes() throws Exception {
        Path base = sequence(root, "Seq", FakeImageCodec.CORRUPT, "Seq.1001.exr");
        Path matte = matteSequence(root, "Seq_matte", "m.1001.exr");

        assertThatThrownBy(() -> embedder.embed(singleChannelTask(base, matte, Compression.PIZ)))
                .isInstanceOf(IOException.class)
                .hasMessageStartingWith("Error opening base file:");
        assertThat(Files.exists(root.resolve("Seq_embedded"))).isFalse();
    }

    @Test
    void writeFailureIsWrappedAndHandlesAreClosed() throws Exception {
        Path base = baseSequence(root, "Seq", "Seq.1001.exr");
        Path matte = matteSequence(root, "Seq_matte", "m.1001.exr");
        doThrow(new IOException("disk full"))
                .when(imageCodec).write(any(Path.class), any(ImageHeader.class), anyMap());

        assertThatThrownBy(() -> embedder.embed(singleChannelTask(base, matte, Compression.PIZ)))
                .isInstanceOf(IOException.class)
                .hasMessage("Error writing output file: disk full");
        verify(imageCodec, times(2)).close(any(ImageHandle.class));
        assertThat(imageCodec.openHandles()).isZero();
    }

    private EmbedTask singleChannelTask(Path base, Path matte, Compression compression) throws IOException {
        String matteFile;
        try (Stream<Path> files = Files.list(matte)) {
            matteFile = files.map(path -> path.getFileName().toString()).findFirst().orElseThrow();
        }
        return task(base, Map.of("base", matte), Map.of("base", matteFile), Map.of("base", "matte"), compression);
    }

    private EmbedTask task(
            Path base,
            Map<String, Path> matteFolders,
            Map<String, String> matteFilenames,
            Map<String, String> channelNames,
            Compression compression) {
        Map<String, String> orderedNames = new LinkedHashMap<>();
        List.of("base", "r", "depth").forEach(key -> {
            if (channelNames.containsKey(key)) {
                orderedNames.put(key, channelNames.get(key));
            }
        });
        Map<String, String> orderedFiles = new LinkedHashMap<>();
        orderedNames.keySet().forEach(key -> orderedFiles.put(key, matteFilenames.get(key)));
        return new EmbedTask(
                base,
                matteFolders,
                "Seq.1001.exr",
                orderedFiles,
                orderedNames,
                compression,
                "matte");
    }
}
