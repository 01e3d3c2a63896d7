package com.github.micycle1.spectraldeform;

/**
 * Thrown when a derivative of a profile is requested but the profile was built
 * without it.
 */
public class DerivativeNotConfiguredException extends IllegalStateException {

	private static final long serialVersionUID = 1L;

	private final String profileName;
	private final int order;

	public DerivativeNotConfiguredException(String profileName, int order) {
		super("Derivative of order " + order + " has not been set for profile '" + profileName + "'");
		this.profileName = profileName;
		this.order = order;
	}

	public String getProfileName() {
		return profileName;
	}

	public int getOrder() {
		return order;
	}
}
