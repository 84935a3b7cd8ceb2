package com.sparrowlogic.networktopology.service;

import com.sparrowlogic.networktopology.model.ResourceKind;

import java.util.function.Consumer;

/**
 * One named step of the create sequence and the resource kind it brings up.
 */
record ProvisioningStep(String name, ResourceKind kind, Consumer<ProvisioningContext> action) {}
