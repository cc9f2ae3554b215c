package com.userintel.common.model.payload;

/** Keys a stated preference can carry. */
public enum PreferenceKey {
    VERBOSITY,
    FORMAT,
    EXPERT_IN,
    LEARNING,
    NAME,
    PREFERRED_NAME,
    ROLE
}
