package com.my.fitsync.adapter.out.credential;

import com.my.fitsync.domain.model.Credential;
import com.my.fitsync.domain.port.out.CredentialStore;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@IfBuildProperty(name = "app.credential.backend", stringValue = "memory")
@ApplicationScoped
public class InMemoryCredentialStore implements CredentialStore {

    private final Map<String, Credential> credentials = new ConcurrentHashMap<>();

    @Override
    public Optional<Credential> get(String accountKey) {
        return Optional.ofNullable(credentials.get(accountKey));
    }

    @Override
    public void put(String accountKey, Credential credential) {
        SqliteCredentialStore.requireSameKey(accountKey, credential);
        // merge 는 키 단위로 원자적이다
        credentials.merge(accountKey, credential, (stored, incoming) ->
                incoming.updatedAt().isBefore(stored.updatedAt())
                        ? stored
                        : new Credential(
                                incoming.accountKey(),
                                incoming.subjectId(),
                                incoming.accessToken(),
                                incoming.refreshToken(),
                                incoming.expiresAt(),
                                incoming.scopes(),
                                incoming.tokenType(),
                                stored.createdAt(),
                                incoming.updatedAt()));
    }

    @Override
    public boolean delete(String accountKey) {
        return credentials.remove(accountKey) != null;
    }
}
