package github.sarthakdev143.film_factory.integration.media;

import github.sarthakdev143.film_factory.model.AssemblyResult;

import java.io.IOException;
import java.util.List;

public interface MediaAssembler {

    /**
     * Concatenates the clips in the given order into one stored artifact.
     */
    AssemblyResult assemble(String filmId, List<String> orderedRefs) throws IOException, InterruptedException;
}
