package uk.gegc.coursemaker.features.batch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import uk.gegc.coursemaker.features.batch.domain.ParentAggregationPolicy;

@Data
@Component
@ConfigurationProperties(prefix = "coursemaker.batch")
public class BatchProperties {

    /**
     * How the parent job combines its children's outcomes.
     * Default: FAIL_FAST
     */
    private ParentAggregationPolicy aggregationPolicy = ParentAggregationPolicy.FAIL_FAST;
}
