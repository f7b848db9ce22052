package io.backup4j.core;

/**
 * Operations the engine can be asked to perform.
 */
public enum OperationKind {
    BACKUP,
    RESTORE,
    LIST,
    LIST_FILESETS,
    LIST_FOLDER_CONTENTS,
    LIST_FILE_VERSIONS,
    SEARCH_ENTRIES,
    LIST_REMOTE,
    DELETE,
    DELETE_ALL_BUT_N_FULL,
    DELETE_OLDER_THAN,
    REPAIR,
    REPAIR_UPDATE,
    RECREATE_DATABASE,
    VERIFY,
    COMPACT,
    VACUUM,
    CREATE_REPORT,
    TEST_CONNECTION,
    CUSTOM
}
