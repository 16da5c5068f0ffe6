package com.watchpost.pipeline.inference;

import com.watchpost.pipeline.acquisition.Frame;
import com.watchpost.pipeline.core.Collaborator;
import com.watchpost.pipeline.core.InferenceException;

/** Natural-language description of a frame, given what was detected in it. */
public interface DescriptionService extends Collaborator {
    String describe(Frame frame, DetectionSet detections) throws InferenceException;
}
