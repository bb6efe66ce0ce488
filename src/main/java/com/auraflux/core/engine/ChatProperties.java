package com.auraflux.core.engine;

import com.auraflux.core.model.Phase;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "auraflux.chat")
public class ChatProperties {

    /** Task type of the chat agent per phase. Phases without an entry have no chat. */
    private Map<Phase, String> agents = new EnumMap<>(Map.of(Phase.INITIATION, "explorer-chat"));

    public Map<Phase, String> getAgents() {
        return agents;
    }

    public void setAgents(Map<Phase, String> agents) {
        this.agents = agents;
    }
}
