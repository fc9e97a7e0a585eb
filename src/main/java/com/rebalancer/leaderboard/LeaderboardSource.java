package com.rebalancer.leaderboard;

import java.util.List;

/**
 * Provider of ranked symbol lists.
 */
public interface LeaderboardSource {

    /**
     * Top {@code n} symbols of an index, best first, upper-cased.
     *
     * @throws com.rebalancer.exception.SourceUnavailableException if the source cannot be
     *         reached, times out, or answers with something that is not a symbol list
     */
    List<String> fetchTopN(String indexId, int n);
}
