package com.my.fitsync.domain.model;

import java.net.URI;

public record AuthorizationRedirect(String accountKey, String state, URI uri) {
}
