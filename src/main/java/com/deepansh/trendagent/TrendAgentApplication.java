package com.deepansh.trendagent;

import com.deepansh.trendagent.config.AgentProperties;
import com.deepansh.trendagent.config.LlmProperties;
import com.deepansh.trendagent.config.ToolProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({AgentProperties.class, ToolProperties.class, LlmProperties.class})
public class TrendAgentApplication {
    public static void main(String[] args) {
        SpringApplication.run(TrendAgentApplication.class, args);
    }
}
