package org.albs.exporter.testutil;

import java.util.List;
import org.albs.exporter.domain.PackageRecord;
import org.albs.exporter.domain.Platform;
import org.albs.exporter.domain.Repository;
import org.albs.exporter.domain.SignKey;

/**
 * Builders for catalog and package fixtures.
 */
public final class Fixtures {
  public static final long PLATFORM_ID = 1L;
  public static final String PLATFORM_NAME = "AlmaLinux-9";
  public static final String SIGN_KEY = "51d6647ec21ad6ea";

  private Fixtures() {}

  public static Repository repo(long id, String name, String arch) {
    return repo(id, name, arch, false);
  }

  public static Repository repo(long id, String name, String arch, boolean debug) {
    String path = "almalinux/9/" + name + "/" + arch + (debug ? "/debug" : "/os");
    return new Repository(id, name, arch, debug, true, path, repoHref(id), PLATFORM_ID);
  }

  public static String repoHref(long id) {
    return "/pulp/api/v3/repositories/rpm/rpm/" + id + "/";
  }

  public static PackageRecord noarch(String name, String version, String release, String sha256) {
    return new PackageRecord(name, version, release, "noarch", sha256, contentHref(name, version, release, sha256));
  }

  public static PackageRecord binary(String name, String version, String release, String arch) {
    return new PackageRecord(name, version, release, arch, "sha-" + name, contentHref(name, version, release, arch));
  }

  public static String contentHref(String... parts) {
    return "/pulp/api/v3/content/rpm/packages/" + String.join("-", parts) + "/";
  }

  public static Platform platform(List<Repository> repositories) {
    return new Platform(PLATFORM_ID, PLATFORM_NAME, false, repositories, List.of(new SignKey(SIGN_KEY, PLATFORM_ID)));
  }
}
