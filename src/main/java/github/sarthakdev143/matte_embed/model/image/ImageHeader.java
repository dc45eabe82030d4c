package github.sarthakdev143.matte_embed.model.image;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record ImageHeader(
        DataWindow dataWindow,
        List<String> channelNames,
        Map<String, String> attributes) {

    public ImageHeader {
        channelNames = channelNames == null ? List.of() : List.copyOf(channelNames);
        attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public boolean hasChannel(String channelName) {
        return channelNames.contains(channelName);
    }
}
