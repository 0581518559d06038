package com.searchsync.sync.auth;

import com.google.auth.oauth2.GoogleCredentials;
import com.searchsync.sync.service.AuthenticationException;
import com.searchsync.sync.service.CredentialNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

@Service
public class SearchConsoleAuthenticator {
    private static final Logger log = LoggerFactory.getLogger(SearchConsoleAuthenticator.class);

    public SearchConsoleSession authenticate(Path credentialsPath, List<String> scopes) {
        if (credentialsPath == null || !Files.isRegularFile(credentialsPath)) {
            log.warn("Search Console credential file not found at {}", credentialsPath);
            throw new CredentialNotFoundException(credentialsPath);
        }
        try (InputStream in = Files.newInputStream(credentialsPath)) {
            GoogleCredentials credentials = GoogleCredentials.fromStream(in).createScoped(scopes);
            log.info("Loaded Search Console credentials from {} with scopes {}", credentialsPath, scopes);
            return new SearchConsoleSession(credentials);
        } catch (Exception e) {
            log.warn("Search Console authentication failed for {}: {}", credentialsPath, e.getMessage());
            throw new AuthenticationException("Unable to build Search Console credentials: " + e.getMessage(), e);
        }
    }
}
