package com.phillippitts.scribedesk;

import com.phillippitts.scribedesk.config.audio.AudioCaptureProperties;
import com.phillippitts.scribedesk.config.properties.ThreadPoolProperties;
import com.phillippitts.scribedesk.config.session.SessionProperties;
import com.phillippitts.scribedesk.config.stt.VoskConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        VoskConfig.class,
        AudioCaptureProperties.class,
        SessionProperties.class,
        ThreadPoolProperties.class
})
@EnableScheduling
public class ScribeDeskApplication {

    public static void main(String[] args) {
        SpringApplication.run(ScribeDeskApplication.class, args);
    }

}
