package io.sellerlink.oauthbroker.auth.model;

import java.net.URI;

public record RedirectTarget(URI location, String state) {}
