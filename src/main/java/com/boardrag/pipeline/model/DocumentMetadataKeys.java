package com.boardrag.pipeline.model;

/**
 * Recognized keys of the {@code documents.metadata} map. Operator tooling reads these by name.
 *
 * <ul>
 *   <li>{@code main_task_id}: first upload task of the creating batch</li>
 *   <li>{@code approved_by}, {@code approved_at}, {@code batch_approval}</li>
 *   <li>{@code rejected_by}, {@code rejected_at}, {@code reject_reason}, {@code batch_rejection}</li>
 *   <li>{@code vectorize_requested_by}, {@code vectorize_requested_at}, {@code full_vectorize},
 *       {@code force_vectorize}, {@code vectorize_task_id}, {@code vectorize_completed_at},
 *       {@code vectorize_chunk_count}, {@code vectorize_file_errors}, {@code vectorize_error}</li>
 *   <li>{@code vector_deleted_at}, {@code vector_deleted_by}, {@code vector_deleted_by_task},
 *       {@code vector_deleted_reason}, {@code vector_delete_requested_by},
 *       {@code vector_delete_task_id}, {@code vector_delete_error}, {@code error_time}</li>
 * </ul>
 */
public final class DocumentMetadataKeys {

    public static final String MAIN_TASK_ID = "main_task_id";

    public static final String APPROVED_BY = "approved_by";
    public static final String APPROVED_AT = "approved_at";
    public static final String BATCH_APPROVAL = "batch_approval";
    public static final String REJECTED_BY = "rejected_by";
    public static final String REJECTED_AT = "rejected_at";
    public static final String REJECT_REASON = "reject_reason";
    public static final String BATCH_REJECTION = "batch_rejection";

    public static final String VECTORIZE_REQUESTED_BY = "vectorize_requested_by";
    public static final String VECTORIZE_REQUESTED_AT = "vectorize_requested_at";
    public static final String FULL_VECTORIZE = "full_vectorize";
    public static final String FORCE_VECTORIZE = "force_vectorize";
    public static final String VECTORIZE_TASK_ID = "vectorize_task_id";
    public static final String VECTORIZE_COMPLETED_AT = "vectorize_completed_at";
    public static final String VECTORIZE_CHUNK_COUNT = "vectorize_chunk_count";
    public static final String VECTORIZE_FILE_ERRORS = "vectorize_file_errors";
    public static final String VECTORIZE_ERROR = "vectorize_error";

    public static final String VECTOR_DELETED_AT = "vector_deleted_at";
    public static final String VECTOR_DELETED_BY = "vector_deleted_by";
    public static final String VECTOR_DELETED_BY_TASK = "vector_deleted_by_task";
    public static final String VECTOR_DELETED_REASON = "vector_deleted_reason";
    public static final String VECTOR_DELETE_REQUESTED_BY = "vector_delete_requested_by";
    public static final String VECTOR_DELETE_TASK_ID = "vector_delete_task_id";
    public static final String VECTOR_DELETE_ERROR = "vector_delete_error";
    public static final String ERROR_TIME = "error_time";

    private DocumentMetadataKeys() {
    }
}
