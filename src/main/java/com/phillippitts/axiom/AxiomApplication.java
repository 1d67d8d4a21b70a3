package com.phillippitts.axiom;

import com.phillippitts.axiom.config.properties.BusProperties;
import com.phillippitts.axiom.config.properties.ContextProperties;
import com.phillippitts.axiom.config.properties.IntentProperties;
import com.phillippitts.axiom.config.properties.PipelineProperties;
import com.phillippitts.axiom.config.properties.PolicyProperties;
import com.phillippitts.axiom.config.properties.ResponseProperties;
import com.phillippitts.axiom.config.properties.StoreProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        PipelineProperties.class,
        PolicyProperties.class,
        IntentProperties.class,
        ResponseProperties.class,
        ContextProperties.class,
        StoreProperties.class,
        BusProperties.class
})
@EnableScheduling
public class AxiomApplication {

    public static void main(String[] args) {
        SpringApplication.run(AxiomApplication.class, args);
    }

}
