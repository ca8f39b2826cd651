package com.starscape.mentana.wiring;

import com.starscape.mentana.common.adapter.AdapterRegistry;
import com.starscape.mentana.common.config.AppProperties;
import com.starscape.mentana.common.config.AwsClientFactory;
import com.starscape.mentana.features.files.domain.FileStorage;
import com.starscape.mentana.features.users.domain.UserRepository;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Publishes the ports to the application context.
 *
 * <p>The registry is the only holder of adapter instances; the port beans below are the
 * registry's cached defaults, resolved once at startup so that a bad backend selector aborts
 * the boot instead of the first request.</p>
 */
@Configuration
public class WiringConfig {

    @Bean(destroyMethod = "close")
    public AdapterRegistry adapterRegistry() {
        return new AdapterRegistry();
    }

    @Bean
    public RepositoryFactory repositoryFactory(AdapterRegistry registry, AppProperties properties,
                                               AwsClientFactory awsClients) {
        return new RepositoryFactory(registry, properties, awsClients);
    }

    @Bean
    public ServiceFactory serviceFactory(AdapterRegistry registry, AppProperties properties,
                                         AwsClientFactory awsClients) {
        return new ServiceFactory(registry, properties, awsClients);
    }

    // closed by the registry
    @Bean(destroyMethod = "")
    public UserRepository userRepository(RepositoryFactory repositoryFactory) {
        return repositoryFactory.resolveUserRepository();
    }

    @Bean(destroyMethod = "")
    public FileStorage fileStorage(ServiceFactory serviceFactory) {
        return serviceFactory.resolveFileStorage();
    }
}
