package com.project.lepidoptera.landmarks.service;

/** Which half of the silhouette a wing lies in, as seen in the picture. */
public enum WingSide {
    LEFT,
    RIGHT
}
