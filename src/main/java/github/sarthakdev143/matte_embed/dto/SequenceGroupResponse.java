package github.sarthakdev143.matte_embed.dto;

import github.sarthakdev143.matte_embed.model.SequenceGroup;

import java.util.LinkedHashMap;
import java.util.Map;

public record SequenceGroupResponse(
        String baseFolder,
        String sequenceType,
        int fileCount,
        Map<String, String> channels) {

    public static SequenceGroupResponse from(SequenceGroup group) {
        Map<String, String> channels = new LinkedHashMap<>();
        group.matteFolders().forEach((channelKey, matteFolder) -> channels.put(
                group.channelNames().getOrDefault(channelKey, channelKey),
                matteFolder.getFileName().toString()));
        return new SequenceGroupResponse(
                group.baseFolder().toString(),
                group.sequenceType(),
                group.baseFiles().size(),
                channels);
    }
}
