package com.phillippitts.talkbox;

import com.phillippitts.talkbox.config.properties.FeedbackProperties;
import com.phillippitts.talkbox.config.properties.LifecycleProperties;
import com.phillippitts.talkbox.config.properties.PipelineProperties;
import com.phillippitts.talkbox.config.properties.PlaybackProperties;
import com.phillippitts.talkbox.config.properties.QueueProperties;
import com.phillippitts.talkbox.config.properties.SupervisorProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        QueueProperties.class,
        PipelineProperties.class,
        SupervisorProperties.class,
        LifecycleProperties.class,
        PlaybackProperties.class,
        FeedbackProperties.class
})
@EnableScheduling
public class TalkBoxApplication {

    public static void main(String[] args) {
        SpringApplication.run(TalkBoxApplication.class, args);
    }

}
