package github.sarthakdev143.matte_embed.service.impl;

import github.sarthakdev143.matte_embed.model.Compression;
import github.sarthakdev143.matte_embed.model.EmbedTask;
import github.sarthakdev143.matte_embed.model.ScanReport;
import github.sarthakdev143.matte_embed.model.SequenceGroup;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class TaskPlanner {

    private final ChannelNameResolver channelNameResolver;

    public TaskPlanner(ChannelNameResolver channelNameResolver) {
        this.channelNameResolver = channelNameResolver;
    }

    public List<EmbedTask> plan(ScanReport report, Compression compression, String matteChannelBasename) {
        List<EmbedTask> tasks = new ArrayList<>(report.totalFiles());
        for (SequenceGroup group : report.groups()) {
            Map<String, String> channelNames = channelNameResolver.resolveAll(
                    group.channelKeys(),
                    matteChannelBasename);

            for (int index = 0; index < group.baseFiles().size(); index++) {
                Map<String, String> matteFilenames = new LinkedHashMap<>();
                for (String channelKey : group.channelKeys()) {
                    matteFilenames.put(channelKey, group.matteFiles().get(channelKey).get(index));
                }
                tasks.add(new EmbedTask(
                        group.baseFolder(),
                        group.matteFolders(),
                        group.baseFiles().get(index),
                        matteFilenames,
                        channelNames,
                        compression,
                        matteChannelBasename));
            }
        }
        return tasks;
    }
}
