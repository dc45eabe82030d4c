package github.sarthakdev143.matte_embed.service;

import github.sarthakdev143.matte_embed.model.ScanReport;

import java.io.IOException;
import java.nio.file.Path;

public interface SequenceDiscoverer {

    ScanReport discover(Path root) throws IOException;
}
