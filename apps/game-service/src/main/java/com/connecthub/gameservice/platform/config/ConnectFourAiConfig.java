package com.connecthub.gameservice.platform.config;

import com.connecthub.gameservice.engine.core.AiAdvisor;
import com.connecthub.gameservice.games.connectfour.domain.ai.BotMove;
import com.connecthub.gameservice.games.connectfour.domain.ai.ConnectFourAI;
import com.connecthub.gameservice.games.connectfour.domain.model.Board;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * AI 对手装配：搜索深度取自 connect4.ai.search-depth。
 */
@Slf4j
@Configuration
public class ConnectFourAiConfig {

    @Bean
    public AiAdvisor<Board, BotMove> connectFourAdvisor(ConnectFourProperties props) {
        ConnectFourAI ai = new ConnectFourAI(props.getAi().getSearchDepth());
        log.info("AI 对手已就绪: searchDepth={}", ai.getSearchDepth());
        return ai;
    }
}
