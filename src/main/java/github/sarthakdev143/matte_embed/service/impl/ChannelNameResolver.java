package github.sarthakdev143.matte_embed.service.impl;

import github.sarthakdev143.matte_embed.model.SequenceGroup;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

@Component
public class ChannelNameResolver {

    private static final Set<String> RESERVED_CHANNELS = Set.of("r", "g", "b", "a");

    public String resolve(String channelKey, String matteChannelBasename) {
        if (channelKey == null || channelKey.isBlank()) {
            throw new IllegalArgumentException("channel key is required.");
        }
        if (SequenceGroup.BASE_CHANNEL_KEY.equals(channelKey)) {
            return matteChannelBasename;
        }

        String lowered = channelKey.toLowerCase(Locale.ROOT);
        if (RESERVED_CHANNELS.contains(lowered)) {
            return matteChannelBasename + ".matte_" + lowered;
        }
        return matteChannelBasename + "." + channelKey;
    }

    public Map<String, String> resolveAll(Collection<String> channelKeys, String matteChannelBasename) {
        validateBasename(matteChannelBasename);

        Map<String, String> resolved = new LinkedHashMap<>();
        Map<String, String> ownerByName = new HashMap<>();
        for (String channelKey : channelKeys) {
            String name = resolve(channelKey, matteChannelBasename);
            String normalizedName = name.toLowerCase(Locale.ROOT);
            if (RESERVED_CHANNELS.contains(normalizedName)) {
                throw new IllegalArgumentException(
                        "Channel " + channelKey + " resolves to reserved channel name " + name + ".");
            }
            String previousOwner = ownerByName.putIfAbsent(normalizedName, channelKey);
            if (previousOwner != null) {
                throw new IllegalArgumentException(
                        "Channels " + previousOwner + " and " + channelKey + " both resolve to " + name + ".");
            }
            resolved.put(channelKey, name);
        }
        return resolved;
    }

    public void validateBasename(String matteChannelBasename) {
        if (matteChannelBasename == null || matteChannelBasename.isBlank()) {
            throw new IllegalArgumentException("Matte channel name is required.");
        }
        if (matteChannelBasename.chars().anyMatch(Character::isWhitespace)) {
            throw new IllegalArgumentException("Matte channel name must not contain whitespace.");
        }
        if (RESERVED_CHANNELS.contains(matteChannelBasename.toLowerCase(Locale.ROOT))) {
            throw new IllegalArgumentException(
                    "Matte channel name must not be one of the base channels R, G, B, A.");
        }
    }

    public boolean isMatteChannel(String channelName, String matteChannelBasename) {
        return channelName.equals(matteChannelBasename) || channelName.startsWith(matteChannelBasename + ".");
    }
}
