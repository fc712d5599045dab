package io.chatpad.pilot.apikey;

import io.chatpad.pilot.agent.AgentRepository;
import io.chatpad.pilot.audit.AuditEventBuilder;
import io.chatpad.pilot.audit.AuditService;
import io.chatpad.pilot.exception.InvalidStateException;
import io.chatpad.pilot.exception.ResourceNotFoundException;
import io.chatpad.pilot.resource.ResourceAuthorizationService;
import io.chatpad.pilot.resource.ResourceType;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ApiKeyService {

  private static final Logger log = LoggerFactory.getLogger(ApiKeyService.class);

  static final String KEY_PREFIX = "pk_live_";
  private static final int KEY_BYTES = 32;
  private static final int DISPLAY_PREFIX_LENGTH = 12;

  private final ApiKeyRepository apiKeyRepository;
  private final AgentRepository agentRepository;
  private final ResourceAuthorizationService authorizationService;
  private final AuditService auditService;
  private final SecureRandom secureRandom = new SecureRandom();

  public ApiKeyService(
      ApiKeyRepository apiKeyRepository,
      AgentRepository agentRepository,
      ResourceAuthorizationService authorizationService,
      AuditService auditService) {
    this.apiKeyRepository = apiKeyRepository;
    this.agentRepository = agentRepository;
    this.authorizationService = authorizationService;
    this.auditService = auditService;
  }

  /**
   * Creates a key, optionally scoped to one of the account's agents. The raw value is returned
   * here only and never stored.
   */
  @Transactional
  public CreatedApiKey create(
      UUID requestedAccountId, String name, UUID agentId, UUID principalId) {
    UUID accountId =
        authorizationService.requireCreateAccount(
            ResourceType.API_KEY, requestedAccountId, principalId);
    if (agentId != null) {
      agentRepository
          .findById(agentId)
          .filter(a -> a.getUserId().equals(accountId))
          .orElseThrow(() -> new ResourceNotFoundException("Agent", agentId));
    }

    String rawKey = generateRawKey();
    var apiKey =
        apiKeyRepository.save(
            new ApiKey(
                accountId,
                agentId,
                name,
                rawKey.substring(0, DISPLAY_PREFIX_LENGTH),
                sha256Hex(rawKey),
                principalId));
    log.info("Created API key {} for account {}", apiKey.getId(), accountId);

    var details = new HashMap<String, Object>();
    details.put("account_id", accountId.toString());
    details.put("name", name);
    details.put("key_prefix", apiKey.getKeyPrefix());
    auditService.log(
        AuditEventBuilder.builder()
            .action("api_key.created")
            .resourceType("api_key")
            .resourceId(apiKey.getId())
            .actorId(principalId)
            .details(details)
            .build());
    return new CreatedApiKey(apiKey, rawKey);
  }

  @Transactional(readOnly = true)
  public List<ApiKey> list(UUID principalId, UUID requestedAccountId) {
    return authorizationService
        .listableAccountId(principalId, requestedAccountId)
        .map(apiKeyRepository::findByUserIdOrderByCreatedAtDesc)
        .orElse(List.of());
  }

  @Transactional(readOnly = true)
  public ApiKey get(UUID apiKeyId, UUID principalId) {
    var apiKey = find(apiKeyId);
    authorizationService.requireViewAccess(ResourceType.API_KEY, apiKey, principalId);
    return apiKey;
  }

  @Transactional
  public ApiKey rename(UUID apiKeyId, String name, UUID principalId) {
    var apiKey = find(apiKeyId);
    authorizationService.requireEditAccess(ResourceType.API_KEY, apiKey, principalId);
    apiKey.rename(name);
    return apiKey;
  }

  /** Revocation is admin-only: plain team members can see and rename keys but not revoke them. */
  @Transactional
  public ApiKey revoke(UUID apiKeyId, UUID principalId) {
    var apiKey = find(apiKeyId);
    authorizationService.requireDeleteAccess(ResourceType.API_KEY, apiKey, principalId);
    if (apiKey.isRevoked()) {
      throw new InvalidStateException("API key already revoked", "Key " + apiKeyId + " is revoked");
    }
    apiKey.revoke();
    log.info("Revoked API key {} of account {}", apiKeyId, apiKey.getUserId());

    var details = new HashMap<String, Object>();
    details.put("account_id", apiKey.getUserId().toString());
    details.put("key_prefix", apiKey.getKeyPrefix());
    auditService.log(
        AuditEventBuilder.builder()
            .action("api_key.revoked")
            .resourceType("api_key")
            .resourceId(apiKeyId)
            .actorId(principalId)
            .details(details)
            .build());
    return apiKey;
  }

  private ApiKey find(UUID apiKeyId) {
    return apiKeyRepository
        .findById(apiKeyId)
        .orElseThrow(() -> new ResourceNotFoundException("API key", apiKeyId));
  }

  private String generateRawKey() {
    byte[] bytes = new byte[KEY_BYTES];
    secureRandom.nextBytes(bytes);
    return KEY_PREFIX + Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
  }

  static String sha256Hex(String value) {
    try {
      var digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  public record CreatedApiKey(ApiKey apiKey, String rawKey) {}
}
