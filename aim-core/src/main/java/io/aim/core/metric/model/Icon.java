package io.aim.core.metric.model;

/// Presentation icon attached to a score band: an icon set and an icon name.
///
/// Either part may be `null`; bands with no icon use {@link #NONE}.
///
/// @param set icon set identifier (e.g. `"fas"`), may be null
/// @param name icon name within the set, may be null
public record Icon(String set, String name) {

    public static final Icon NONE = new Icon(null, null);

    public boolean isEmpty() {
        return set == null && name == null;
    }
}
