package com.github.micycle1.lightning;

import com.github.micycle1.lightning.tree.BranchContinuation;

/**
 * Immutable set of tunables for generating and propagating Lightning trees. All
 * distances are in integer coordinate units.
 */
public final class LightningSettings {

	private final double lineWidth;
	private final double pruneDistance;
	private final double smoothMagnitude;
	private final double maxRemoveColinearDist;
	private final double maxSnapDistance;
	private final double locatorCellSize;
	private final BranchContinuation branchContinuation;
	private final boolean parallel;

	private LightningSettings(Builder builder) {
		this.lineWidth = requireNonNegative(builder.lineWidth, "lineWidth");
		this.pruneDistance = requireNonNegative(builder.pruneDistance, "pruneDistance");
		this.smoothMagnitude = requireNonNegative(builder.smoothMagnitude, "smoothMagnitude");
		this.maxRemoveColinearDist = requireNonNegative(builder.maxRemoveColinearDist, "maxRemoveColinearDist");
		this.maxSnapDistance = requireNonNegative(builder.maxSnapDistance, "maxSnapDistance");
		if (!(builder.locatorCellSize > 0)) {
			throw new IllegalArgumentException("locatorCellSize must be positive, got " + builder.locatorCellSize);
		}
		this.locatorCellSize = builder.locatorCellSize;
		if (builder.branchContinuation == null) {
			throw new IllegalArgumentException("branchContinuation cannot be null");
		}
		this.branchContinuation = builder.branchContinuation;
		this.parallel = builder.parallel;
	}

	private static double requireNonNegative(double value, String name) {
		if (!(value >= 0) || Double.isInfinite(value)) {
			throw new IllegalArgumentException(name + " must be a finite non-negative number, got " + value);
		}
		return value;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Derives settings from the printing angles, the way a slicer exposes them.
	 * Pruning and straightening distances are how far a line may move sideways
	 * from one layer to the next while still resting on the layer below:
	 * {@code layerThickness * tan(angle)}.
	 *
	 * @param lineWidth          width of the printed infill lines
	 * @param layerThickness     height of one layer
	 * @param pruneAngle         overhang angle (radians) over which branch ends
	 *                           are pruned per layer
	 * @param straighteningAngle overhang angle (radians) over which lines may be
	 *                           straightened per layer
	 */
	public static LightningSettings fromAngles(double lineWidth, double layerThickness, double pruneAngle, double straighteningAngle) {
		return builder().lineWidth(lineWidth) //
				.pruneDistance(layerThickness * Math.tan(pruneAngle)) //
				.smoothMagnitude(layerThickness * Math.tan(straighteningAngle)) //
				.maxRemoveColinearDist(LightningConstants.LOCATOR_CELL_SIZE / 2) //
				.build();
	}

	public double getLineWidth() {
		return lineWidth;
	}

	public double getPruneDistance() {
		return pruneDistance;
	}

	public double getSmoothMagnitude() {
		return smoothMagnitude;
	}

	public double getMaxRemoveColinearDist() {
		return maxRemoveColinearDist;
	}

	public double getMaxSnapDistance() {
		return maxSnapDistance;
	}

	public double getLocatorCellSize() {
		return locatorCellSize;
	}

	public BranchContinuation getBranchContinuation() {
		return branchContinuation;
	}

	/**
	 * @return whether the trees of a layer are propagated concurrently
	 */
	public boolean isParallel() {
		return parallel;
	}

	@Override
	public String toString() {
		return "LightningSettings{lineWidth=" + lineWidth + ", prune=" + pruneDistance + ", smooth=" + smoothMagnitude + ", colinear="
				+ maxRemoveColinearDist + ", snap=" + maxSnapDistance + ", cell=" + locatorCellSize + ", " + branchContinuation
				+ (parallel ? ", parallel" : "") + '}';
	}

	public static final class Builder {

		private double lineWidth = 400;
		private double pruneDistance = 0;
		private double smoothMagnitude = 0;
		private double maxRemoveColinearDist = 0;
		private double maxSnapDistance = LightningConstants.MAX_SNAP_DISTANCE;
		private double locatorCellSize = LightningConstants.LOCATOR_CELL_SIZE;
		private BranchContinuation branchContinuation = BranchContinuation.FIRST_CHILD;
		private boolean parallel = false;

		private Builder() {
		}

		public Builder lineWidth(double lineWidth) {
			this.lineWidth = lineWidth;
			return this;
		}

		public Builder pruneDistance(double pruneDistance) {
			this.pruneDistance = pruneDistance;
			return this;
		}

		public Builder smoothMagnitude(double smoothMagnitude) {
			this.smoothMagnitude = smoothMagnitude;
			return this;
		}

		public Builder maxRemoveColinearDist(double maxRemoveColinearDist) {
			this.maxRemoveColinearDist = maxRemoveColinearDist;
			return this;
		}

		public Builder maxSnapDistance(double maxSnapDistance) {
			this.maxSnapDistance = maxSnapDistance;
			return this;
		}

		public Builder locatorCellSize(double locatorCellSize) {
			this.locatorCellSize = locatorCellSize;
			return this;
		}

		public Builder branchContinuation(BranchContinuation branchContinuation) {
			this.branchContinuation = branchContinuation;
			return this;
		}

		public Builder parallel(boolean parallel) {
			this.parallel = parallel;
			return this;
		}

		public LightningSettings build() {
			return new LightningSettings(this);
		}
	}
}
