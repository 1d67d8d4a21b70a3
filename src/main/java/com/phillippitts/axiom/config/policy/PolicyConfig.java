package com.phillippitts.axiom.config.policy;

import com.phillippitts.axiom.config.properties.PolicyProperties;
import com.phillippitts.axiom.service.policy.CharacterSetValidator;
import com.phillippitts.axiom.service.policy.ContentFilterValidator;
import com.phillippitts.axiom.service.policy.LengthValidator;
import com.phillippitts.axiom.service.policy.PathTraversalValidator;
import com.phillippitts.axiom.service.policy.PolicyEngine;
import com.phillippitts.axiom.service.policy.RateLimitValidator;
import com.phillippitts.axiom.service.policy.SqlInjectionValidator;
import com.phillippitts.axiom.service.policy.Validator;
import com.phillippitts.axiom.service.policy.XssValidator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the validator chain in evaluation order.
 */
@Configuration
public class PolicyConfig {

    private static final Logger LOG = LogManager.getLogger(PolicyConfig.class);

    @Bean
    public PolicyEngine policyEngine(PolicyProperties properties) {
        List<Validator> validators = new ArrayList<>();
        validators.add(new LengthValidator(properties.getMaxInputLength(), properties.getMaxOutputLength()));
        validators.add(new SqlInjectionValidator());
        validators.add(new XssValidator());
        validators.add(new PathTraversalValidator());
        if (!properties.getBannedWords().isEmpty()) {
            validators.add(new ContentFilterValidator(properties.getBannedWords()));
        }
        if (properties.isRejectControlCharacters()) {
            validators.add(new CharacterSetValidator());
        }
        PolicyProperties.RateLimit rateLimit = properties.getRateLimit();
        if (rateLimit.isEnabled()) {
            validators.add(new RateLimitValidator(rateLimit.getCapacity(), rateLimit.getRefillPeriod()));
        }
        LOG.info("Policy engine configured with {} validators: {}", validators.size(),
                validators.stream().map(v -> v.getClass().getSimpleName()).toList());
        return new PolicyEngine(validators);
    }
}
