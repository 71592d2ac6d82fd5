package com.propertyguess.fmvengine.domain.service;

import com.propertyguess.fmvengine.domain.model.KarmaRank;
import org.springframework.stereotype.Component;

@Component
public class KarmaRankResolver {

    /**
     * Total over all ints; negative scores resolve as 0.
     */
    public KarmaRank resolve(int karma) {
        return KarmaRank.findRank(karma);
    }

    public KarmaRank resolve(Integer karma) {
        return resolve(karma == null ? 0 : karma.intValue());
    }
}
