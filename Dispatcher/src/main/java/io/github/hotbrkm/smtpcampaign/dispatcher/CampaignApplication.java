package io.github.hotbrkm.smtpcampaign.dispatcher;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

@Slf4j
@SpringBootApplication(scanBasePackages = {"io.github.hotbrkm.smtpcampaign.dispatcher"})
public class CampaignApplication {

    private static final String PROFILE_PROPERTY = "spring.profiles.active";
    private static final String DEFAULT_PROFILE = "default";

    public static void main(String[] args) {
        String profile = System.getProperty(PROFILE_PROPERTY, DEFAULT_PROFILE);

        log.info("Starting campaign dispatcher with profile: {}", profile);

        ConfigurableApplicationContext context = new SpringApplicationBuilder(CampaignApplication.class)
                .web(WebApplicationType.NONE)
                .profiles(profile)
                .run(args);
        System.exit(SpringApplication.exit(context));
    }
}
