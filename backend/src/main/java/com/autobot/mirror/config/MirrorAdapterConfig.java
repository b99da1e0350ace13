package com.autobot.mirror.config;

import com.autobot.mirror.adapter.GitRemoteClient;
import com.autobot.mirror.adapter.ProcessGitRemoteClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MirrorAdapterConfig {

    @Bean
    public GitRemoteClient gitRemoteClient(MirrorProperties properties,
                                           @Value("${autobot.mirror.git-executable:git}") String gitExecutable) {
        return new ProcessGitRemoteClient(gitExecutable, properties.getGitCommandTimeout());
    }
}
