package com.connecthub.gameservice.games.connectfour.application;

import com.connecthub.gameservice.games.connectfour.domain.model.Outcome;
import com.connecthub.gameservice.games.connectfour.domain.model.Participant;
import com.connecthub.gameservice.games.connectfour.domain.model.Session;
import com.connecthub.gameservice.games.connectfour.domain.model.SessionStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionRegistryTest {

    private SessionRegistry registry;
    private Session session;

    @BeforeEach
    void setUp() {
        registry = new SessionRegistry();
        session = new Session("s1",
                Participant.human("p_a", "alice", "c-a", 0L),
                Participant.human("p_b", "bob", "c-b", 0L),
                0L);
        registry.register(session);
    }

    @Test
    @DisplayName("登记后可按对局、参与者、连接三种方式查找")
    void indexesOnRegister() {
        assertThat(registry.find("s1")).containsSame(session);
        assertThat(registry.findByParticipant("p_b")).containsSame(session);
        assertThat(registry.findByConnection("c-a")).containsSame(session);
        assertThat(registry.activeCount()).isEqualTo(1);
        assertThatThrownBy(() -> registry.register(session)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("连接解绑与重新绑定")
    void rebindsConnections() {
        registry.unbindConnection("c-b");
        assertThat(registry.findByConnection("c-b")).isEmpty();

        registry.bindConnection("c-b2", "s1");
        assertThat(registry.findByConnection("c-b2")).containsSame(session);
    }

    @Test
    @DisplayName("结束后移除索引但保留对局，evict 只清理终态对局")
    void terminateThenEvict() {
        assertThat(registry.evict("s1")).isFalse();

        session.finish(SessionStatus.COMPLETED, Outcome.winner("p_a"), 10L);
        registry.terminate(session);

        assertThat(registry.findByParticipant("p_a")).isEmpty();
        assertThat(registry.findByConnection("c-a")).isEmpty();
        assertThat(registry.find("s1")).isPresent();
        assertThat(registry.activeCount()).isZero();

        assertThat(registry.evict("s1")).isTrue();
        assertThat(registry.find("s1")).isEmpty();
        assertThat(registry.size()).isZero();
    }
}
