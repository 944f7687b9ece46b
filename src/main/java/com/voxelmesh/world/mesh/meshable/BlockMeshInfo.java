package com.voxelmesh.world.mesh.meshable;

import com.voxelmesh.world.Block;
import com.voxelmesh.world.FluidInstance;

/** The block being meshed, its data and the fluid in the same position. */
public record BlockMeshInfo(Block block, int data, FluidInstance fluid) {
}
