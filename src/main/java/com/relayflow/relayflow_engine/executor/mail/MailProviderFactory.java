package com.relayflow.relayflow_engine.executor.mail;

import com.relayflow.relayflow_engine.exception.ConfigValidationException;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Component
public class MailProviderFactory {

    private final Map<String, MailProvider> providerMap = new LinkedHashMap<>();

    public MailProviderFactory(List<MailProvider> providers) {
        for (MailProvider provider : providers) {
            providerMap.put(provider.getName(), provider);
        }
    }

    public MailProvider getProvider(String name) {
        MailProvider provider = providerMap.get(name);
        if (provider == null) {
            throw new ConfigValidationException("No mail provider named '" + name + "'; known: " + providerMap.keySet());
        }
        return provider;
    }

    public Set<String> providerNames() {
        return providerMap.keySet();
    }
}
