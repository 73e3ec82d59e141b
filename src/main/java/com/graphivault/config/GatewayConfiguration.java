package com.graphivault.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.graphivault.infrastructure.crypto.CommandRunner;
import com.graphivault.infrastructure.crypto.EncryptionGateway;
import com.graphivault.infrastructure.crypto.ProcessCommandRunner;
import com.graphivault.infrastructure.crypto.ProcessEncryptionGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
public class GatewayConfiguration {

    @Bean
    public CommandRunner commandRunner(VaultProperties properties) {
        return new ProcessCommandRunner(properties.getGateway().getWorkingDirectory());
    }

    @Bean
    public EncryptionGateway encryptionGateway(CommandRunner commandRunner, VaultProperties properties,
                                               ObjectMapper objectMapper) {
        VaultProperties.Gateway gateway = properties.getGateway();
        log.info("Encryption gateway command: {} (password via {})",
            gateway.getCommand(), gateway.getPasswordTransport());
        return new ProcessEncryptionGateway(commandRunner, gateway.getCommand(),
            gateway.getPasswordTransport(), objectMapper);
    }
}
