package com.adlanda.resumetailor.ai;

import java.util.List;

/**
 * Bullet ids chosen by the backend, most relevant first.
 *
 * The ids are whatever the backend said; they are not guaranteed to belong to
 * the candidate set until the caller has filtered them.
 */
public record BulletSelection(List<String> selectedBulletIds, String reasoning) {

    public BulletSelection {
        selectedBulletIds = selectedBulletIds == null ? List.of() : List.copyOf(selectedBulletIds);
        reasoning = reasoning == null ? "" : reasoning;
    }
}
