package com.boardrag.pipeline.model;

/**
 * Recognized keys of the {@code document_files.metadata} map.
 *
 * <ul>
 *   <li>intake: {@code upload_type} (sync or deferred), {@code uploaded_by}, {@code task_id}</li>
 *   <li>upload result: {@code upload_completed_at}, {@code upload_task_id}, {@code file_size},
 *       {@code content_type}, {@code upload_validation_success}, {@code upload_attempts},
 *       {@code validation_attempts}</li>
 *   <li>failure: {@code upload_error}, {@code error_time}</li>
 *   <li>reupload: {@code reuploaded_by}, {@code reuploaded_at}, {@code original_error},
 *       {@code reupload_task_id}</li>
 *   <li>visibility: {@code is_public}, {@code visibility_changed_by}, {@code visibility_changed_at}</li>
 * </ul>
 */
public final class FileMetadataKeys {

    public static final String UPLOAD_TYPE = "upload_type";
    public static final String UPLOADED_BY = "uploaded_by";
    public static final String TASK_ID = "task_id";

    public static final String UPLOAD_COMPLETED_AT = "upload_completed_at";
    public static final String UPLOAD_TASK_ID = "upload_task_id";
    public static final String FILE_SIZE = "file_size";
    public static final String CONTENT_TYPE = "content_type";
    public static final String UPLOAD_VALIDATION_SUCCESS = "upload_validation_success";
    public static final String UPLOAD_ATTEMPTS = "upload_attempts";
    public static final String VALIDATION_ATTEMPTS = "validation_attempts";

    public static final String UPLOAD_ERROR = "upload_error";
    public static final String ERROR_TIME = "error_time";

    public static final String REUPLOADED_BY = "reuploaded_by";
    public static final String REUPLOADED_AT = "reuploaded_at";
    public static final String ORIGINAL_ERROR = "original_error";
    public static final String REUPLOAD_TASK_ID = "reupload_task_id";

    public static final String IS_PUBLIC = "is_public";
    public static final String VISIBILITY_CHANGED_BY = "visibility_changed_by";
    public static final String VISIBILITY_CHANGED_AT = "visibility_changed_at";

    public static final String UPLOAD_TYPE_SYNC = "sync";
    public static final String UPLOAD_TYPE_DEFERRED = "deferred";

    private FileMetadataKeys() {
    }
}
