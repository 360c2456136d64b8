package com.brixo.colecture.image.service;

/**
 * Estados del pipeline de selección de imagen. Sólo se usan para trazar las
 * transiciones en los logs.
 */
enum PipelineState {
    START,
    EXTRACTING,
    SKIPPED,
    ROUTING,
    STOCK_PATH,
    SUITABLE,
    NONE_FOUND,
    AI_PATH,
    GENERATING,
    GENERATED,
    FAILED,
    SAFETY_CHECK,
    SAFE,
    RETRY,
    DONE
}
