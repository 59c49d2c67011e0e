package com.scholary.transcripthub.media;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scholary.transcripthub.exception.ConflictException;
import com.scholary.transcripthub.exception.NotFoundException;
import java.time.Clock;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

/**
 * Maps content identities to assets.
 *
 * <p>Two Caffeine caches without eviction: one by asset id, one by (namespace, content key). The
 * key index is written with {@code putIfAbsent}, which is the uniqueness constraint: of two
 * concurrent registrations of the same key exactly one wins and the other gets a {@link
 * ConflictException} naming the winner.
 *
 * <p>Get-or-create is {@link #resolve} followed by {@link #register}; see {@link
 * #resolveOrRegister} for the collapsing variant.
 */
@Repository
public class MediaRegistry {

  private static final Logger LOGGER = LoggerFactory.getLogger(MediaRegistry.class);

  private final Cache<String, Asset> assetsById = Caffeine.newBuilder().build();
  private final Cache<ContentKey, Asset> assetsByKey = Caffeine.newBuilder().build();
  private final Clock clock;

  public MediaRegistry(Clock clock) {
    this.clock = clock;
  }

  /**
   * Look up an asset by content key.
   *
   * @throws NotFoundException if no asset has this key in {@code namespace}
   */
  public Asset resolve(String contentKey, ContentNamespace namespace) {
    Asset asset = assetsByKey.getIfPresent(new ContentKey(namespace, contentKey));
    if (asset == null) {
      throw NotFoundException.asset(namespace + ":" + contentKey);
    }
    return asset;
  }

  /**
   * Register a new asset.
   *
   * @throws ConflictException if the key already exists in {@code namespace}
   */
  public Asset register(String contentKey, ContentNamespace namespace, AssetMetadata metadata) {
    Asset candidate =
        new Asset(
            UUID.randomUUID().toString(),
            contentKey,
            namespace,
            metadata.displayName(),
            metadata.mimeType(),
            metadata.owner(),
            clock.instant());

    Asset existing =
        assetsByKey.asMap().putIfAbsent(new ContentKey(namespace, contentKey), candidate);
    if (existing != null) {
      throw new ConflictException(
          String.format("Asset already registered: %s:%s", namespace, contentKey),
          existing.id());
    }
    assetsById.put(candidate.id(), candidate);
    LOGGER.info(
        "Registered asset: id={}, namespace={}, contentKey={}, name={}",
        candidate.id(),
        namespace,
        contentKey,
        metadata.displayName());
    return candidate;
  }

  /**
   * Resolve the asset for a key, registering it when absent.
   *
   * <p>A registration that loses a race collapses onto the winner.
   *
   * @return the asset and whether this call created it
   */
  public Registration resolveOrRegister(
      String contentKey, ContentNamespace namespace, AssetMetadata metadata) {
    try {
      return new Registration(resolve(contentKey, namespace), false);
    } catch (NotFoundException notFound) {
      try {
        return new Registration(register(contentKey, namespace, metadata), true);
      } catch (ConflictException conflict) {
        LOGGER.info(
            "Concurrent registration of {}:{} collapsed onto asset {}",
            namespace,
            contentKey,
            conflict.getExistingId());
        return new Registration(resolve(contentKey, namespace), false);
      }
    }
  }

  public Optional<Asset> findById(String assetId) {
    return Optional.ofNullable(assetsById.getIfPresent(assetId));
  }

  public void delete(Asset asset) {
    assetsByKey.asMap().remove(new ContentKey(asset.namespace(), asset.contentKey()), asset);
    assetsById.invalidate(asset.id());
    LOGGER.info("Deleted asset: id={}, contentKey={}", asset.id(), asset.contentKey());
  }

  /**
   * Result of {@link #resolveOrRegister}.
   *
   * @param asset the resolved or newly registered asset
   * @param created whether the asset was registered by this call
   */
  public record Registration(Asset asset, boolean created) {}

  private record ContentKey(ContentNamespace namespace, String key) {}
}
