package org.nowstart.retune.service;

import java.util.List;
import lombok.RequiredArgsConstructor;
import org.nowstart.retune.data.dto.SearchSpace;
import org.nowstart.retune.data.property.SearchProperties;
import org.springframework.cloud.context.config.annotation.RefreshScope;
import org.springframework.stereotype.Service;

@Service
@RefreshScope
@RequiredArgsConstructor
public class SearchSpaceResolver {

    private final SearchProperties searchProperties;

    public SearchSpace resolve(String horizon) {
        List<Integer> contextLengths = searchProperties.contextLengths().get(horizon);
        if (contextLengths == null || contextLengths.isEmpty()) {
            contextLengths = searchProperties.defaultContextLengths();
        }
        return new SearchSpace(contextLengths, searchProperties.numSamples(), searchProperties.temperatures());
    }
}
