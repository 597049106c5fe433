package com.railwise.backend.config;

import com.google.auth.oauth2.GoogleCredentials;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.FirestoreOptions;
import com.railwise.backend.model.TrainCrowdRecord;
import com.railwise.backend.repository.DataRepository;
import com.railwise.backend.repository.firestore.GenericFirestoreRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import java.io.ByteArrayInputStream;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Wires the crowd confirmation store. Confirmations are mirrored to the
 * {@value #CROWD_COLLECTION} Firestore collection when credentials resolve,
 * otherwise the repository is a no-op and crowd data stays in memory.
 */
@Configuration
@Slf4j
public class RepositoryConfig {

    static final String CROWD_COLLECTION = "crowdValidations";

    @Value("${firestore.project-id:}")
    private String projectId;

    @Value("${firestore.service-account-path:}")
    private String credentialsPath;

    @Value("${firestore.service-account-json:}")
    private String credentialsJson;

    @Value("${firestore.use-default-credentials:true}")
    private boolean useDefaultCredentials = true;

    @Bean
    public DataRepository<TrainCrowdRecord, String> crowdRepository() {
        return new GenericFirestoreRepository<>(
                connectCrowdStore().orElse(null),
                CROWD_COLLECTION,
                TrainCrowdRecord.class,
                TrainCrowdRecord::getTrainNumber);
    }

    Optional<Firestore> connectCrowdStore() {
        Optional<GoogleCredentials> credentials = resolveCredentials();
        if (credentials.isEmpty()) {
            log.warn("⚠️ No Firestore credentials. Crowd confirmations are kept in memory only.");
            return Optional.empty();
        }

        FirestoreOptions.Builder options = FirestoreOptions.newBuilder().setCredentials(credentials.get());
        if (StringUtils.hasText(projectId)) {
            options.setProjectId(projectId);
        }
        Firestore firestore = options.build().getService();
        log.info("✅ Crowd confirmations persisted to {}/{}",
                StringUtils.hasText(projectId) ? projectId : "(default)", CROWD_COLLECTION);
        return Optional.of(firestore);
    }

    /**
     * Inline JSON wins over a key file, which wins over the GCP default chain.
     * A credential source that fails to load disables persistence rather than
     * startup.
     */
    Optional<GoogleCredentials> resolveCredentials() {
        try {
            if (StringUtils.hasText(credentialsJson)) {
                log.info("🔐 Loading crowd store credentials from inline JSON");
                InputStream stream = new ByteArrayInputStream(credentialsJson.getBytes(StandardCharsets.UTF_8));
                return Optional.of(GoogleCredentials.fromStream(stream));
            }
            if (StringUtils.hasText(credentialsPath)) {
                log.info("🔐 Loading crowd store credentials from {}", credentialsPath);
                try (InputStream stream = new FileInputStream(credentialsPath)) {
                    return Optional.of(GoogleCredentials.fromStream(stream));
                }
            }
            if (useDefaultCredentials) {
                return Optional.of(GoogleCredentials.getApplicationDefault());
            }
        } catch (IOException e) {
            log.warn("⚠️ Crowd store credentials unavailable: {}", e.getMessage());
        }
        return Optional.empty();
    }
}
