package github.sarthakdev143.film_factory.service;

import java.util.Map;

@FunctionalInterface
public interface GenerationWork {

    /**
     * @return the result stored with the completed job
     */
    Map<String, Object> execute(JobContext context) throws Exception;
}
