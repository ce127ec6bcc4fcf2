/*-
 * #%L
 * This file is part of PixEdit.
 * %%
 * Copyright (C) 2025 PixEdit developers
 * %%
 * PixEdit is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * PixEdit is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with PixEdit.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package pixedit;

import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonParseException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;
import pixedit.lib.io.GsonTools;
import pixedit.lib.io.JsonPresetStore;
import pixedit.lib.kernels.Kernel;
import pixedit.lib.kernels.StructuringElement;
import pixedit.lib.processing.Kernels;
import pixedit.lib.processing.StructuringElements;

/**
 * Manage custom kernels and structuring elements, stored as JSON in the preset directory.
 */
@Command(name = "presets", description = "Manage custom kernel and structuring element presets.",
	subcommands = {PresetsCommand.ListCommand.class, PresetsCommand.SaveCommand.class, 
			PresetsCommand.RenameCommand.class, PresetsCommand.DeleteCommand.class})
class PresetsCommand implements Callable<Integer> {
	
	private final static Logger logger = LoggerFactory.getLogger(PresetsCommand.class);
	
	enum PresetType {
		KERNEL, ELEMENT
	}
	
	@Spec
	private CommandSpec spec;
	
	@Option(names = {"-t", "--type"}, description = "Preset type: ${COMPLETION-CANDIDATES} (default = KERNEL).", paramLabel = "type")
	private PresetType type = PresetType.KERNEL;

	@Override
	public Integer call() {
		spec.commandLine().usage(spec.commandLine().getOut());
		return 0;
	}
	
	private List<String> getBuiltInNames() {
		return switch (type) {
			case KERNEL -> Kernels.getPresetNames();
			case ELEMENT -> StructuringElements.getPresetNames();
		};
	}
	
	private JsonPresetStore<?> getStore() {
		return switch (type) {
			case KERNEL -> JsonPresetStore.forKernels(getBuiltInNames());
			case ELEMENT -> JsonPresetStore.forStructuringElements(getBuiltInNames());
		};
	}
	
	@Command(name = "list", description = "List built-in and custom presets.")
	static class ListCommand implements Callable<Integer> {
		
		@ParentCommand
		private PresetsCommand parent;
		
		@Spec
		private CommandSpec spec;

		@Override
		public Integer call() {
			var out = spec.commandLine().getOut();
			var store = parent.getStore();
			for (var name : parent.getBuiltInNames())
				out.println(name + " (built-in)");
			for (var name : store.list())
				out.println(name + ": " + GsonTools.getInstance().toJson(store.get(name).orElseThrow()));
			return 0;
		}
		
	}
	
	@Command(name = "save", description = "Add or replace a custom preset.")
	static class SaveCommand implements Callable<Integer> {
		
		@ParentCommand
		private PresetsCommand parent;
		
		@Spec
		private CommandSpec spec;
		
		@Parameters(index = "0", description = "Preset name.", paramLabel = "name")
		private String name;
		
		@Parameters(index = "1", description = "JSON array of values, e.g. [[0,1,0],[1,1,1],[0,1,0]].", paramLabel = "json")
		private String json;

		@Override
		public Integer call() throws Exception {
			try {
				switch (parent.type) {
				case KERNEL:
					var kernel = GsonTools.getInstance().fromJson(json, Kernel.class);
					JsonPresetStore.forKernels(Kernels.getPresetNames()).put(name, requireValue(kernel));
					break;
				case ELEMENT:
					var element = GsonTools.getInstance().fromJson(json, StructuringElement.class);
					JsonPresetStore.forStructuringElements(StructuringElements.getPresetNames()).put(name, requireValue(element));
					break;
				}
			} catch (JsonParseException | IllegalArgumentException e) {
				throw new ParameterException(spec.commandLine(), e.getLocalizedMessage(), e);
			}
			logger.info("Saved preset '{}'", name.strip());
			return 0;
		}
		
		private <T> T requireValue(T value) {
			if (value == null)
				throw new ParameterException(spec.commandLine(), "No preset value found");
			return value;
		}
		
	}
	
	@Command(name = "rename", description = "Rename a custom preset.")
	static class RenameCommand implements Callable<Integer> {
		
		@ParentCommand
		private PresetsCommand parent;
		
		@Spec
		private CommandSpec spec;
		
		@Parameters(index = "0", description = "Current name.", paramLabel = "name")
		private String oldName;
		
		@Parameters(index = "1", description = "New name.", paramLabel = "new-name")
		private String newName;

		@Override
		public Integer call() throws Exception {
			try {
				if (!parent.getStore().rename(oldName, newName)) {
					logger.error("No custom preset named '{}'", oldName);
					return 1;
				}
			} catch (IllegalArgumentException e) {
				throw new ParameterException(spec.commandLine(), e.getLocalizedMessage(), e);
			}
			logger.info("Renamed preset '{}' to '{}'", oldName, newName);
			return 0;
		}
		
	}
	
	@Command(name = "delete", description = "Delete a custom preset.")
	static class DeleteCommand implements Callable<Integer> {
		
		@ParentCommand
		private PresetsCommand parent;
		
		@Parameters(index = "0", description = "Preset name.", paramLabel = "name")
		private String name;

		@Override
		public Integer call() throws Exception {
			if (!parent.getStore().delete(name)) {
				logger.error("No custom preset named '{}'", name);
				return 1;
			}
			logger.info("Deleted preset '{}'", name);
			return 0;
		}
		
	}

}
