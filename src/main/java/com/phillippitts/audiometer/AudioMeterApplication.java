package com.phillippitts.audiometer;

import com.phillippitts.audiometer.config.properties.DspProperties;
import com.phillippitts.audiometer.config.properties.MeteringProperties;
import com.phillippitts.audiometer.config.properties.RecordingProperties;
import com.phillippitts.audiometer.config.properties.WebSocketProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        DspProperties.class,
        MeteringProperties.class,
        RecordingProperties.class,
        WebSocketProperties.class
})
@EnableScheduling
public class AudioMeterApplication {

    public static void main(String[] args) {
        SpringApplication.run(AudioMeterApplication.class, args);
    }

}
