package github.sarthakdev143.film_factory.config;

import github.sarthakdev143.film_factory.service.impl.RestartResumer;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(1)
@ConditionalOnProperty(name = "film-factory.recovery.enabled", havingValue = "true", matchIfMissing = true)
public class StartupRecoveryRunner implements ApplicationRunner {

    private final RestartResumer restartResumer;

    public StartupRecoveryRunner(RestartResumer restartResumer) {
        this.restartResumer = restartResumer;
    }

    @Override
    public void run(ApplicationArguments args) {
        restartResumer.recover();
    }
}
